package com.deepansh.orchestrator.notification;

import com.deepansh.orchestrator.model.ProgressStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressNotifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final List<String> contentTypes = new CopyOnWriteArrayList<>();
    private final AtomicInteger responseStatus = new AtomicInteger(200);

    private HttpServer server;
    private String callbackUrl;
    private ProgressNotifier notifier;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            contentTypes.add(exchange.getRequestHeaders().getFirst("Content-Type"));
            exchange.sendResponseHeaders(responseStatus.get(), -1);
            exchange.close();
        });
        server.start();
        callbackUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/hook";
        notifier = new ProgressNotifier(objectMapper, Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        notifier.close();
        server.stop(0);
    }

    @Test
    void send_2xx_returnsTrueAndPostsWirePayload() throws Exception {
        boolean delivered = notifier.send("s-1", callbackUrl, "Iteration 1/10", ProgressStatus.PROCESSING, false);

        assertThat(delivered).isTrue();
        assertThat(bodies).hasSize(1);
        assertThat(contentTypes.get(0)).startsWith("application/json");

        JsonNode body = objectMapper.readTree(bodies.get(0));
        assertThat(body.get("sessionId").asText()).isEqualTo("s-1");
        assertThat(body.get("partialMessage").asText()).isEqualTo("Iteration 1/10");
        assertThat(body.get("status").asText()).isEqualTo("processing");
        assertThat(body.get("isComplete").asBoolean()).isFalse();
        assertThat(body.has("complete")).isFalse();
    }

    @Test
    void send_severalUpdates_arriveInOrderOverOneChannel() throws Exception {
        notifier.send("s-1", callbackUrl, "first", ProgressStatus.PROCESSING, false);
        notifier.send("s-1", callbackUrl, "second", ProgressStatus.PROCESSING, false);
        notifier.send("s-1", callbackUrl, "done", ProgressStatus.COMPLETED, true);

        assertThat(bodies).hasSize(3);
        assertThat(objectMapper.readTree(bodies.get(2)).get("status").asText()).isEqualTo("completed");
        assertThat(objectMapper.readTree(bodies.get(2)).get("isComplete").asBoolean()).isTrue();
        assertThat(bodies.get(0)).contains("first");
        assertThat(bodies.get(1)).contains("second");
    }

    @Test
    void send_5xx_returnsFalse() {
        responseStatus.set(500);

        assertThat(notifier.send("s-1", callbackUrl, "x", ProgressStatus.ERROR, true)).isFalse();
        assertThat(bodies).hasSize(1);
    }

    @Test
    void send_unreachable_returnsFalse() {
        server.stop(0);

        assertThat(notifier.send("s-1", callbackUrl, "x", ProgressStatus.PROCESSING, false)).isFalse();
    }

    @Test
    void send_blankOrMalformedUrl_returnsFalse() {
        assertThat(notifier.send("s-1", null, "x", ProgressStatus.PROCESSING, false)).isFalse();
        assertThat(notifier.send("s-1", " ", "x", ProgressStatus.PROCESSING, false)).isFalse();
        assertThat(notifier.send("s-1", "not a url", "x", ProgressStatus.PROCESSING, false)).isFalse();
    }

    @Test
    void close_releasesChannelAndRejectsLaterSends() {
        assertThat(notifier.hasChannel()).isFalse();
        notifier.send("s-1", callbackUrl, "x", ProgressStatus.PROCESSING, false);
        assertThat(notifier.hasChannel()).isTrue();

        notifier.close();

        assertThat(notifier.isOpen()).isFalse();
        assertThat(notifier.hasChannel()).isFalse();
        assertThat(notifier.send("s-1", callbackUrl, "late", ProgressStatus.COMPLETED, true)).isFalse();
        assertThat(bodies).hasSize(1);
    }
}
