package com.airsentinel.service.store;

import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.pipeline.ingest.PersistenceUnavailableException;
import com.airsentinel.pipeline.ingest.ReadingQuery;
import com.airsentinel.pipeline.ingest.ReadingStore;
import com.airsentinel.pipeline.ingest.StoredReading;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class JsonlReadingStore implements ReadingStore {
    private static final Comparator<StoredReading> NEWEST_FIRST = Comparator
            .comparingDouble((StoredReading stored) -> stored.reading().timestamp())
            .thenComparingLong(StoredReading::id)
            .reversed();

    private final JsonlFile file;
    private final ReentrantLock lock = new ReentrantLock();
    private long nextId = -1;

    public JsonlReadingStore(Path file) {
        this.file = new JsonlFile(file);
    }

    public Path file() {
        return file.path();
    }

    @Override
    public long append(EnrichedReading reading) {
        lock.lock();
        try {
            if (nextId < 0) {
                nextId = readAll().stream().mapToLong(StoredReading::id).max().orElse(0) + 1;
            }
            long id = nextId;
            file.append(JsonUtils.objectMapper().writeValueAsString(new StoredReading(id, reading)));
            nextId++;
            return id;
        } catch (IOException e) {
            throw new PersistenceUnavailableException("Failed appending reading to " + file.path(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StoredReading> query(ReadingQuery query) {
        lock.lock();
        try {
            List<StoredReading> matches = new ArrayList<>();
            for (StoredReading stored : readAll()) {
                if (query.matches(stored)) {
                    matches.add(stored);
                }
            }
            matches.sort(NEWEST_FIRST);
            if (query.offset() >= matches.size()) {
                return List.of();
            }
            int end = Math.min(matches.size(), query.offset() + query.limit());
            return List.copyOf(matches.subList(query.offset(), end));
        } catch (IOException e) {
            throw new PersistenceUnavailableException("Failed querying readings in " + file.path(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StoredReading> findById(long id) {
        lock.lock();
        try {
            return readAll().stream().filter(stored -> stored.id() == id).findFirst();
        } catch (IOException e) {
            throw new PersistenceUnavailableException("Failed reading " + file.path(), e);
        } finally {
            lock.unlock();
        }
    }

    private List<StoredReading> readAll() throws IOException {
        List<StoredReading> readings = new ArrayList<>();
        int lineNumber = 0;
        for (String line : file.readLines()) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                readings.add(JsonUtils.objectMapper().readValue(line, StoredReading.class));
            } catch (IOException | RuntimeException decodeError) {
                throw new IllegalStateException("Invalid JSONL reading at line " + lineNumber, decodeError);
            }
        }
        return readings;
    }
}
