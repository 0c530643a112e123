package com.airsentinel.service.api;

import com.airsentinel.core.advice.RiskAdvisor;
import com.airsentinel.core.alert.AlertEvaluator;
import com.airsentinel.core.model.AlertRecord;
import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.ValidationException;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.pipeline.answer.Answer;
import com.airsentinel.pipeline.answer.AssistantService;
import com.airsentinel.pipeline.broadcast.BroadcastHub;
import com.airsentinel.pipeline.ingest.IngestResult;
import com.airsentinel.pipeline.ingest.IngestionGateway;
import com.airsentinel.pipeline.ingest.PersistenceUnavailableException;
import com.airsentinel.pipeline.ingest.RawReadingPayload;
import com.airsentinel.pipeline.ingest.ReadingQuery;
import com.airsentinel.pipeline.ingest.ReadingStore;
import com.airsentinel.pipeline.ingest.StoredReading;
import com.airsentinel.service.store.JsonlAlertStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    public static final String VERSION = "1.0.0";
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String EVENTS_PATH = "/api/events";

    private final int port;
    private final IngestionGateway gateway;
    private final ReadingStore readingStore;
    private final AlertEvaluator alertEvaluator;
    private final JsonlAlertStore alertStore;
    private final BroadcastHub hub;
    private final RiskAdvisor riskAdvisor;
    private final AssistantService assistantService;
    private final SseStreamHandler streamHandler;
    private final DiagnosticsTracker diagnosticsTracker;
    private final Map<String, Object> componentStates;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            IngestionGateway gateway,
            ReadingStore readingStore,
            AlertEvaluator alertEvaluator,
            JsonlAlertStore alertStore,
            BroadcastHub hub,
            RiskAdvisor riskAdvisor,
            AssistantService assistantService,
            SseStreamHandler streamHandler,
            DiagnosticsTracker diagnosticsTracker,
            Map<String, Object> componentStates
    ) {
        this.port = port;
        this.gateway = gateway;
        this.readingStore = readingStore;
        this.alertEvaluator = alertEvaluator;
        this.alertStore = alertStore;
        this.hub = hub;
        this.riskAdvisor = riskAdvisor;
        this.assistantService = assistantService;
        this.streamHandler = streamHandler;
        this.diagnosticsTracker = diagnosticsTracker;
        this.componentStates = Map.copyOf(componentStates);
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext(EVENTS_PATH, this::handleEvents);
            server.createContext("/api/alerts", this::handleAlerts);
            server.createContext("/api/risk", this::handleRisk);
            server.createContext("/api/recommendation", this::handleRecommendation);
            server.createContext("/api/query", this::handleQuery);
            server.createContext("/api/metrics", this::handleMetrics);
            server.createContext("/api/stream", streamHandler::handle);
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET"))) {
            return;
        }
        Map<String, Object> components = new LinkedHashMap<>(componentStates);
        components.put("subscribers", hub.subscriberCount());
        components.put("trackedSources", gateway.trackedSources());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("version", VERSION);
        body.put("components", components);
        writeJson(exchange, 200, body);
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET", "POST"))) {
            return;
        }
        String path = exchange.getRequestURI().getPath();
        if (path.length() > EVENTS_PATH.length() + 1 && path.startsWith(EVENTS_PATH + "/")) {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendStatus(exchange, 405);
                return;
            }
            handleEventById(exchange, path.substring(EVENTS_PATH.length() + 1));
            return;
        }
        if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            handleIngest(exchange);
        } else {
            handleEventQuery(exchange);
        }
    }

    private void handleIngest(HttpExchange exchange) throws IOException {
        RawReadingPayload payload;
        try {
            payload = JsonUtils.objectMapper().readValue(readBody(exchange), RawReadingPayload.class);
        } catch (JsonProcessingException e) {
            writeInvalidJson(exchange, e);
            return;
        }
        IngestResult result;
        try {
            result = gateway.ingest(payload);
        } catch (ValidationException e) {
            writeValidationError(exchange, e);
            return;
        }
        Map<String, Object> body = readingView(result.reading());
        body.put("id", result.id());
        writeJson(exchange, 201, body);
    }

    private void handleEventQuery(HttpExchange exchange) throws IOException {
        ReadingQuery query;
        try {
            Map<String, String> params = queryParams(exchange.getRequestURI());
            Optional<String> source = Optional.ofNullable(params.get("source")).filter(value -> !value.isBlank());
            double since = params.containsKey("since") ? Double.parseDouble(params.get("since")) : Double.NEGATIVE_INFINITY;
            int limit = params.containsKey("limit") ? Integer.parseInt(params.get("limit")) : 100;
            int offset = params.containsKey("offset") ? Integer.parseInt(params.get("offset")) : 0;
            query = new ReadingQuery(source, since, Math.min(Math.max(1, limit), ReadingQuery.MAX_LIMIT), offset);
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        try {
            List<Map<String, Object>> dto = readingStore.query(query).stream().map(ApiServer::storedView).toList();
            writeJson(exchange, 200, dto);
        } catch (PersistenceUnavailableException e) {
            writeStorageUnavailable(exchange, e);
        }
    }

    private void handleEventById(HttpExchange exchange, String rawId) throws IOException {
        long id;
        try {
            id = Long.parseLong(rawId);
        } catch (NumberFormatException e) {
            writeJson(exchange, 400, Map.of("error", "invalid_id"));
            return;
        }
        try {
            Optional<StoredReading> stored = readingStore.findById(id);
            if (stored.isEmpty()) {
                writeJson(exchange, 404, Map.of("error", "not_found"));
                return;
            }
            writeJson(exchange, 200, storedView(stored.get()));
        } catch (PersistenceUnavailableException e) {
            writeStorageUnavailable(exchange, e);
        }
    }

    private void handleAlerts(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET"))) {
            return;
        }
        boolean activeOnly = "true".equalsIgnoreCase(queryParams(exchange.getRequestURI()).get("active"));
        if (activeOnly) {
            writeJson(exchange, 200, alertEvaluator.activeAlerts());
            return;
        }
        try {
            List<AlertRecord> alerts = alertStore.all();
            writeJson(exchange, 200, alerts);
        } catch (PersistenceUnavailableException e) {
            writeStorageUnavailable(exchange, e);
        }
    }

    private void handleRisk(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET"))) {
            return;
        }
        Optional<EnrichedReading> latest = latestReading();
        if (latest.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "no_readings"));
            return;
        }
        writeJson(exchange, 200, riskAdvisor.assess(latest.get()));
    }

    private void handleRecommendation(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET"))) {
            return;
        }
        Optional<EnrichedReading> latest = latestReading();
        if (latest.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "no_readings"));
            return;
        }
        writeJson(exchange, 200, riskAdvisor.recommend(latest.get().severity()));
    }

    private void handleQuery(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("POST"))) {
            return;
        }
        String question;
        try {
            JsonNode body = JsonUtils.objectMapper().readTree(readBody(exchange));
            question = body == null ? null : body.path("query").asText(null);
        } catch (JsonProcessingException e) {
            writeInvalidJson(exchange, e);
            return;
        }
        try {
            Answer answer = assistantService.ask(question);
            writeJson(exchange, 200, answer);
        } catch (ValidationException e) {
            writeValidationError(exchange, e);
        }
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, Set.of("GET"))) {
            return;
        }
        writeJson(exchange, 200, diagnosticsTracker.metricsSnapshot());
    }

    private Optional<EnrichedReading> latestReading() {
        Optional<EnrichedReading> live = hub.lastRealReading();
        if (live.isPresent()) {
            return live;
        }
        try {
            return readingStore.latest().map(StoredReading::reading);
        } catch (PersistenceUnavailableException e) {
            LOGGER.log(Level.WARNING, "Reading store unavailable while looking up latest reading", e);
            return Optional.empty();
        }
    }

    private boolean ensureMethod(HttpExchange exchange, Set<String> allowed) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        if ("OPTIONS".equals(method)) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", String.join(",", allowed) + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            sendStatus(exchange, 204);
            return false;
        }
        if (!allowed.contains(method)) {
            sendStatus(exchange, 405);
            return false;
        }
        return true;
    }

    private static Map<String, Object> readingView(EnrichedReading reading) {
        return JsonUtils.objectMapper().convertValue(reading, new TypeReference<LinkedHashMap<String, Object>>() {
        });
    }

    private static Map<String, Object> storedView(StoredReading stored) {
        Map<String, Object> view = readingView(stored.reading());
        view.put("id", stored.id());
        return view;
    }

    private void writeValidationError(HttpExchange exchange, ValidationException e) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "validation_failed");
        body.put("field", e.field());
        body.put("message", e.getMessage());
        writeJson(exchange, 400, body);
    }

    private void writeInvalidJson(HttpExchange exchange, JsonProcessingException e) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "invalid_json");
        body.put("message", String.valueOf(e.getOriginalMessage()));
        writeJson(exchange, 400, body);
    }

    private void writeStorageUnavailable(HttpExchange exchange, PersistenceUnavailableException e) throws IOException {
        LOGGER.log(Level.WARNING, "Request failed, storage unavailable", e);
        writeJson(exchange, 503, Map.of("error", "storage_unavailable"));
    }

    private static byte[] readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return in.readAllBytes();
        }
    }

    private static void sendStatus(HttpExchange exchange, int status) throws IOException {
        exchange.sendResponseHeaders(status, -1);
        exchange.close();
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
