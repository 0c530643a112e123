package com.airsentinel.service.store;

import com.airsentinel.core.model.AlertRecord;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.pipeline.ingest.AlertSink;
import com.airsentinel.pipeline.ingest.PersistenceUnavailableException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

// Every transition is a new line; the current view of an alert is the last line with its id.
public class JsonlAlertStore implements AlertSink {
    private final JsonlFile file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlAlertStore(Path file) {
        this.file = new JsonlFile(file);
    }

    public Path file() {
        return file.path();
    }

    @Override
    public void append(AlertRecord alert) {
        lock.lock();
        try {
            file.append(JsonUtils.objectMapper().writeValueAsString(alert));
        } catch (IOException e) {
            throw new PersistenceUnavailableException("Failed appending alert to " + file.path(), e);
        } finally {
            lock.unlock();
        }
    }

    public List<AlertRecord> all() {
        return List.copyOf(latestById().values());
    }

    public List<AlertRecord> active() {
        List<AlertRecord> active = new ArrayList<>();
        for (AlertRecord alert : latestById().values()) {
            if (!alert.resolved()) {
                active.add(alert);
            }
        }
        return active;
    }

    public List<AlertRecord> history() {
        lock.lock();
        try {
            return readAll();
        } catch (IOException e) {
            throw new PersistenceUnavailableException("Failed reading alerts in " + file.path(), e);
        } finally {
            lock.unlock();
        }
    }

    private Map<String, AlertRecord> latestById() {
        Map<String, AlertRecord> latest = new LinkedHashMap<>();
        for (AlertRecord alert : history()) {
            latest.put(alert.id(), alert);
        }
        return latest;
    }

    private List<AlertRecord> readAll() throws IOException {
        List<AlertRecord> alerts = new ArrayList<>();
        int lineNumber = 0;
        for (String line : file.readLines()) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                alerts.add(JsonUtils.objectMapper().readValue(line, AlertRecord.class));
            } catch (IOException | RuntimeException decodeError) {
                throw new IllegalStateException("Invalid JSONL alert at line " + lineNumber, decodeError);
            }
        }
        return alerts;
    }
}
