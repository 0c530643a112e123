package com.airsentinel.pipeline.replay;

import com.airsentinel.pipeline.api.Collector;
import com.airsentinel.pipeline.api.CollectorContext;
import com.airsentinel.pipeline.api.CollectorResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class InboxCollector implements Collector {
    public static final String CONFIG_KEY = "inboxCollector";
    static final String PROCESSED_DIR = "processed";
    static final String FAILED_DIR = "failed";
    private static final Logger LOGGER = Logger.getLogger(InboxCollector.class.getName());

    private final Duration interval;

    public InboxCollector() {
        this(Duration.ofSeconds(2));
    }

    public InboxCollector(Duration interval) {
        this.interval = interval;
    }

    @Override
    public String name() {
        return "inboxCollector";
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        try {
            InboxCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, InboxCollectorConfig.class);
            return CompletableFuture.completedFuture(drain(cfg, ctx));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CollectorResult drain(InboxCollectorConfig cfg, CollectorContext ctx) {
        List<Path> files = pendingFiles(cfg.inputPath());
        int ingested = 0;
        int malformed = 0;
        int rejected = 0;
        int failed = 0;
        for (Path file : files) {
            ReplayReport report;
            try {
                report = ctx.replayService().replay(file);
            } catch (RuntimeException e) {
                failed++;
                LOGGER.log(Level.WARNING, "Replay of " + file + " failed; moving it to " + FAILED_DIR, e);
                quarantine(file, cfg);
                continue;
            }
            ingested += report.ingested();
            malformed += report.malformed();
            rejected += report.rejected();
            retire(file, cfg);
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("files", files.size());
        stats.put("ingested", ingested);
        stats.put("malformed", malformed);
        stats.put("rejected", rejected);
        stats.put("failed", failed);
        return CollectorResult.success("Replayed " + files.size() + " file(s)", stats);
    }

    private void retire(Path file, InboxCollectorConfig cfg) {
        try {
            if (cfg.deleteProcessed()) {
                Files.deleteIfExists(file);
            } else {
                Path archive = cfg.inputPath().resolve(PROCESSED_DIR);
                Files.createDirectories(archive);
                Files.move(file, archive.resolve(file.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not retire processed file " + file, e);
        }
    }

    // Unreadable files leave the inbox too, otherwise every run would stop on them again.
    private void quarantine(Path file, InboxCollectorConfig cfg) {
        try {
            Path target = cfg.inputPath().resolve(FAILED_DIR);
            Files.createDirectories(target);
            Files.move(file, target.resolve(file.getFileName()), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not quarantine " + file, e);
        }
    }

    private List<Path> pendingFiles(Path inputDir) {
        if (!Files.isDirectory(inputDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(inputDir)) {
            List<Path> files = new ArrayList<>(entries
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.endsWith(".json") || name.endsWith(".jsonl");
                    })
                    .toList());
            files.sort(null);
            return files;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed listing inbox " + inputDir, e);
        }
    }
}
