package com.airsentinel.service.api;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.SubscriberDropped;
import com.airsentinel.core.model.EnrichedReading;
import com.airsentinel.core.model.Severity;
import com.airsentinel.pipeline.broadcast.BroadcastHub;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpPrincipal;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SseStreamHandlerTest {
    private final EventBus eventBus = new EventBus((event, error) -> {
        throw new AssertionError("Unexpected handler error", error);
    });
    private final BroadcastHub hub = new BroadcastHub(8, Clock.systemUTC(), eventBus);
    private final SseStreamHandler handler = new SseStreamHandler(hub, Duration.ofSeconds(5));

    @Test
    void handleReturnsPromptlyWhenThreadAlreadyInterrupted() throws Exception {
        FakeHttpExchange exchange = new FakeHttpExchange("GET", new ByteArrayOutputStream());

        try {
            Thread.currentThread().interrupt();
            handler.handle(exchange);
        } finally {
            Thread.interrupted();
        }

        assertEquals(200, exchange.responseCode);
        assertTrue(exchange.responseHeaders.getFirst("Content-Type").contains("text/event-stream"));
        assertTrue(exchange.body().startsWith(": connected"));
        assertEquals(0, hub.subscriberCount());
    }

    @Test
    void publishedReadingIsWrittenAsOneDataFrame() throws Exception {
        ByteArrayOutputStream sink = new ByteArrayOutputStream() {
            private boolean published;

            @Override
            public synchronized void write(byte[] b, int off, int len) {
                super.write(b, off, len);
                String chunk = new String(b, off, len, StandardCharsets.UTF_8);
                if (!published) {
                    published = true;
                    hub.publish(new EnrichedReading("sensor-1", 420.5, null, 1000.0, 1.0, 0.2, Severity.DANGER, false, false));
                } else if (chunk.startsWith("data:")) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        FakeHttpExchange exchange = new FakeHttpExchange("GET", sink);

        try {
            handler.handle(exchange);
        } finally {
            Thread.interrupted();
        }

        String body = exchange.body();
        assertTrue(body.contains("data: {"));
        assertTrue(body.contains("\"co2_ppm\":420.5"));
        assertTrue(body.contains("\"severity\":\"danger\""));
        assertTrue(body.endsWith("\n\n"));
        assertEquals(0, hub.subscriberCount());
    }

    @Test
    void writeFailureDropsSubscriberAsTransportError() throws Exception {
        List<SubscriberDropped> dropped = new CopyOnWriteArrayList<>();
        eventBus.subscribe(SubscriberDropped.class, dropped::add);
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Broken pipe");
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                throw new IOException("Broken pipe");
            }
        };
        FakeHttpExchange exchange = new FakeHttpExchange("GET", broken);

        handler.handle(exchange);

        assertEquals(0, hub.subscriberCount());
        assertEquals(1, dropped.size());
        assertEquals("transport_error", dropped.get(0).reason());
    }

    @Test
    void nonGetIsRejected() throws Exception {
        FakeHttpExchange exchange = new FakeHttpExchange("POST", new ByteArrayOutputStream());

        handler.handle(exchange);

        assertEquals(405, exchange.responseCode);
        assertEquals(0, hub.subscriberCount());
    }

    private static final class FakeHttpExchange extends HttpExchange {
        private final Headers requestHeaders = new Headers();
        private final Headers responseHeaders = new Headers();
        private final String method;
        private final OutputStream responseBody;
        private int responseCode = -1;

        private FakeHttpExchange(String method, OutputStream responseBody) {
            this.method = method;
            this.responseBody = responseBody;
        }

        String body() {
            if (responseBody instanceof ByteArrayOutputStream bytes) {
                return bytes.toString(StandardCharsets.UTF_8);
            }
            return "";
        }

        @Override
        public Headers getRequestHeaders() {
            return requestHeaders;
        }

        @Override
        public Headers getResponseHeaders() {
            return responseHeaders;
        }

        @Override
        public URI getRequestURI() {
            return URI.create("/api/stream");
        }

        @Override
        public String getRequestMethod() {
            return method;
        }

        @Override
        public HttpContext getHttpContext() {
            return null;
        }

        @Override
        public void close() {
        }

        @Override
        public InputStream getRequestBody() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public OutputStream getResponseBody() {
            return responseBody;
        }

        @Override
        public void sendResponseHeaders(int rCode, long responseLength) {
            this.responseCode = rCode;
        }

        @Override
        public InetSocketAddress getRemoteAddress() {
            return new InetSocketAddress("127.0.0.1", 12345);
        }

        @Override
        public int getResponseCode() {
            return responseCode;
        }

        @Override
        public InetSocketAddress getLocalAddress() {
            return new InetSocketAddress("127.0.0.1", 8080);
        }

        @Override
        public String getProtocol() {
            return "HTTP/1.1";
        }

        @Override
        public Object getAttribute(String name) {
            return null;
        }

        @Override
        public void setAttribute(String name, Object value) {
        }

        @Override
        public void setStreams(InputStream i, OutputStream o) {
            throw new UnsupportedOperationException("not needed in tests");
        }

        @Override
        public HttpPrincipal getPrincipal() {
            return null;
        }
    }
}
