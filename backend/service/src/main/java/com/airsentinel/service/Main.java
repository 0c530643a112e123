package com.airsentinel.service;

import com.airsentinel.core.advice.RiskAdvisor;
import com.airsentinel.core.alert.AlertEvaluator;
import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.feature.FeatureExtractor;
import com.airsentinel.core.model.CollectorConfig;
import com.airsentinel.core.model.PipelineSettings;
import com.airsentinel.pipeline.answer.AssistantService;
import com.airsentinel.pipeline.api.CollectorContext;
import com.airsentinel.pipeline.broadcast.BroadcastHub;
import com.airsentinel.pipeline.broadcast.HeartbeatTask;
import com.airsentinel.pipeline.ingest.IngestionGateway;
import com.airsentinel.pipeline.replay.InboxCollector;
import com.airsentinel.pipeline.replay.InboxCollectorConfig;
import com.airsentinel.pipeline.replay.ReplayService;
import com.airsentinel.service.answer.HttpAnsweringClient;
import com.airsentinel.service.api.ApiServer;
import com.airsentinel.service.api.DiagnosticsTracker;
import com.airsentinel.service.api.SseStreamHandler;
import com.airsentinel.service.config.ConfigLoader;
import com.airsentinel.service.http.HttpClientFactory;
import com.airsentinel.service.runtime.SchedulerService;
import com.airsentinel.service.store.JsonlAlertStore;
import com.airsentinel.service.store.JsonlReadingStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        RuntimeSettings runtime = resolveRuntimeSettings(System.getenv(), LOGGER::warning);
        Clock clock = Clock.systemUTC();

        PipelineSettings settings = ConfigLoader.loadPipeline(runtime.configDir());
        List<CollectorConfig> collectorConfigs = ConfigLoader.loadCollectors(runtime.configDir());
        InboxCollectorConfig inboxConfig = ConfigLoader.loadInbox(runtime.configDir());
        Map<String, CollectorConfig> collectorConfigByName = new HashMap<>();
        for (CollectorConfig cfg : collectorConfigs) {
            collectorConfigByName.put(cfg.name(), cfg);
        }

        EventBus eventBus = new EventBus();
        JsonlReadingStore readingStore = new JsonlReadingStore(runtime.dataDir().resolve("readings.jsonl"));
        JsonlAlertStore alertStore = new JsonlAlertStore(runtime.dataDir().resolve("alerts.jsonl"));
        FeatureExtractor extractor = new FeatureExtractor(settings.thresholds(), settings.anomaly());
        AlertEvaluator alertEvaluator = new AlertEvaluator(settings.thresholds());
        BroadcastHub hub = new BroadcastHub(settings.stream().subscriberQueueCapacity(), clock, eventBus);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock, hub::subscriberCount);
        IngestionGateway gateway = new IngestionGateway(
                extractor,
                alertEvaluator,
                hub,
                readingStore,
                alertStore,
                eventBus,
                clock
        );
        ReplayService replayService = new ReplayService(gateway, eventBus, clock);
        HeartbeatTask heartbeat = new HeartbeatTask(hub, extractor, settings.stream(), clock, eventBus);

        InboxCollector inboxCollector = new InboxCollector(
                intervalFor(collectorConfigByName, InboxCollector.CONFIG_KEY, inboxConfig.interval())
        );
        CollectorContext context = new CollectorContext(
                eventBus,
                replayService,
                clock,
                Map.of(InboxCollector.CONFIG_KEY, inboxConfig)
        );
        SchedulerService scheduler = new SchedulerService(
                List.of(new SchedulerService.ScheduledCollector(
                        inboxCollector,
                        inboxCollector.interval(),
                        isEnabled(collectorConfigByName, InboxCollector.CONFIG_KEY, true)
                )),
                context
        );

        HttpAnsweringClient answeringClient = new HttpAnsweringClient(
                HttpClientFactory.create(Duration.ofSeconds(5)),
                Duration.ofSeconds(20),
                runtime.answeringUrl()
        );
        if (!answeringClient.isConfigured()) {
            LOGGER.info("ANSWERING_URL not set; /api/query answers from the fallback template.");
        }
        AssistantService assistantService = new AssistantService(answeringClient, hub, clock);

        ApiServer apiServer = new ApiServer(
                runtime.port(),
                gateway,
                readingStore,
                alertEvaluator,
                alertStore,
                hub,
                new RiskAdvisor(settings.thresholds()),
                assistantService,
                new SseStreamHandler(hub, settings.stream().keepAlive()),
                diagnosticsTracker,
                Map.of(
                        "readingStore", readingStore.file().toString(),
                        "alertStore", alertStore.file().toString(),
                        "answering", answeringClient.isConfigured() ? "configured" : "fallback",
                        "heartbeatCadence", settings.stream().heartbeatCadence().toString()
                )
        );

        scheduler.start();
        heartbeat.start();
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            scheduler.shutdown();
            heartbeat.stop();
            hub.shutdown();
            apiServer.stop();
            shutdownLatch.countDown();
        }));
        shutdownLatch.await();
    }

    static RuntimeSettings resolveRuntimeSettings(Map<String, String> env, Consumer<String> warn) {
        int port = 8080;
        String rawPort = env.get("PORT");
        if (rawPort != null && !rawPort.isBlank()) {
            try {
                port = Integer.parseInt(rawPort.trim());
            } catch (NumberFormatException e) {
                warn.accept("Invalid PORT='" + rawPort + "'; falling back to 8080.");
            }
        }
        return new RuntimeSettings(
                port,
                Path.of(env.getOrDefault("DATA_DIR", "data")),
                Path.of(env.getOrDefault("CONFIG_DIR", "config")),
                env.getOrDefault("ANSWERING_URL", "")
        );
    }

    static Duration intervalFor(Map<String, CollectorConfig> configs, String name, Duration fallback) {
        CollectorConfig cfg = configs.get(name);
        if (cfg == null || cfg.intervalSeconds() <= 0) {
            return fallback;
        }
        return Duration.ofSeconds(cfg.intervalSeconds());
    }

    static boolean isEnabled(Map<String, CollectorConfig> configs, String name, boolean fallback) {
        CollectorConfig cfg = configs.get(name);
        return cfg == null ? fallback : cfg.enabled();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not load logging.properties: " + e.getMessage());
        }
    }

    record RuntimeSettings(int port, Path dataDir, Path configDir, String answeringUrl) {
    }
}
