package com.airsentinel.service.api;

import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.pipeline.broadcast.BroadcastHub;
import com.airsentinel.pipeline.broadcast.Subscription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

public class SseStreamHandler {
    private static final Logger LOGGER = Logger.getLogger(SseStreamHandler.class.getName());

    private final BroadcastHub hub;
    private final Duration keepAlive;

    public SseStreamHandler(BroadcastHub hub, Duration keepAlive) {
        this.hub = hub;
        this.keepAlive = keepAlive;
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, 0);

        OutputStream out = exchange.getResponseBody();
        Subscription subscription = hub.subscribe();
        try {
            writeRaw(out, ": connected\n\n");
            while (!Thread.currentThread().isInterrupted() && !subscription.isClosed()) {
                Optional<EnrichedReading> next = subscription.poll(keepAlive);
                if (next.isPresent()) {
                    writeRaw(out, "data: " + toSseData(next.get()) + "\n\n");
                } else if (!subscription.isClosed()) {
                    writeRaw(out, ": keepalive\n\n");
                }
            }
        } catch (IOException e) {
            LOGGER.fine("Stream client " + subscription.id() + " disconnected: " + e.getMessage());
            hub.unsubscribe(subscription, "transport_error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            hub.unsubscribe(subscription);
            closeQuietly(out);
            exchange.close();
        }
    }

    static String toSseData(EnrichedReading reading) {
        try {
            return JsonUtils.objectMapper().writeValueAsString(reading);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode reading for stream", e);
        }
    }

    private static void writeRaw(OutputStream out, String data) throws IOException {
        out.write(data.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static void closeQuietly(OutputStream out) {
        try {
            out.close();
        } catch (IOException e) {
            LOGGER.finest("Stream already closed: " + e.getMessage());
        }
    }
}
