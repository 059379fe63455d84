package com.deepansh.orchestrator.capability.mcp;

import com.deepansh.orchestrator.capability.CapabilityDescriptor;
import com.deepansh.orchestrator.capability.CapabilityInvoker;
import com.deepansh.orchestrator.capability.CapabilityProvider;
import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.exception.CapabilityProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Capability provider backed by an MCP (Model Context Protocol) server over stdio.
 *
 * <p>Lifecycle:
 * <ol>
 * <li>Launch the server process with the configured shell command and environment
 * <li>{@code initialize} handshake, then {@code notifications/initialized}
 * <li>{@code tools/list} once, cached as the advertised capabilities
 * <li>{@code tools/call} per invocation
 * <li>{@link #close()} destroys the process
 * </ol>
 *
 * <p>JSON-RPC 2.0, one message per line. A reader thread matches responses to
 * pending requests by id; stderr is drained to the DEBUG log.
 */
@Slf4j
public class McpCapabilityProvider implements CapabilityProvider {

    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {};

    private final OrchestratorProperties.Capabilities.Mcp config;
    private final ObjectMapper objectMapper;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private Process process;
    private BufferedWriter writer;
    private volatile boolean running;
    private List<CapabilityDescriptor> advertised = List.of();

    public McpCapabilityProvider(OrchestratorProperties.Capabilities.Mcp config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Start the server and fetch its tool list. On any failure the process is torn down
     * before the exception propagates.
     */
    public McpCapabilityProvider start() {
        log.info("[MCP] Starting server: {}", config.getCommand());
        try {
            ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", config.getCommand());
            pb.environment().putAll(config.getEnv());
            process = pb.start();
        } catch (IOException e) {
            throw new CapabilityProviderException("Could not launch MCP server: " + e.getMessage(), e);
        }
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(this::readLoop, "mcp-reader");
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr");
        stderrThread.setDaemon(true);
        stderrThread.start();

        try {
            JsonNode initResult = await(sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of("name", "tool-orchestrator", "version", "0.1.0"))),
                    config.getStartupTimeoutSeconds());
            log.info("[MCP] Initialized: {}", initResult);

            sendNotification("notifications/initialized");

            JsonNode toolsResult = await(sendRequest("tools/list", Map.of()), config.getStartupTimeoutSeconds());
            advertised = parseToolDescriptors(toolsResult);
            log.info("[MCP] Available tools: {}", advertised.stream().map(CapabilityDescriptor::getName).toList());
            return this;
        } catch (RuntimeException e) {
            log.error("[MCP] Initialization failed, cleaning up: {}", e.getMessage());
            close();
            throw e;
        }
    }

    @Override
    public List<CapabilityDescriptor> listCapabilities() {
        return advertised;
    }

    @Override
    public Map<String, Object> call(String name, Map<String, Object> arguments) {
        if (!isRunning()) {
            return Map.of(CapabilityInvoker.ERROR_KEY, "No active MCP connection");
        }
        JsonNode result = await(sendRequest("tools/call", Map.of(
                "name", name,
                "arguments", arguments != null ? arguments : Map.of())),
                config.getRequestTimeoutSeconds());
        return parseToolCallResult(result);
    }

    private JsonNode await(CompletableFuture<JsonNode> future, int timeoutSeconds) {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityProviderException("Interrupted waiting for MCP server", e);
        } catch (TimeoutException e) {
            throw new CapabilityProviderException("MCP server did not answer within " + timeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CapabilityProviderException("MCP request failed: " + cause.getMessage(), cause);
        }
    }

    private CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            writeLine(objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }
        return future.whenComplete((r, ex) -> pendingRequests.remove(id));
    }

    private void sendNotification(String method) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        try {
            writeLine(objectMapper.writeValueAsString(notification));
        } catch (IOException e) {
            log.warn("[MCP] Failed to send notification {}: {}", method, e.getMessage());
        }
    }

    private void writeLine(String json) throws IOException {
        log.debug("[MCP] -> {}", json);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) return;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    dispatch(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP] Reader thread error: {}", e.getMessage());
            }
        } finally {
            pendingRequests.values().forEach(f -> f.completeExceptionally(new IOException("MCP process closed")));
            pendingRequests.clear();
        }
    }

    void dispatch(String line) {
        log.debug("[MCP] <- {}", line);
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[MCP] Failed to parse message: {}", e.getMessage());
            return;
        }

        JsonNode idNode = message.get("id");
        if (idNode == null || !idNode.isInt()) {
            log.debug("[MCP] Server notification: {}", message.path("method").asText("unknown"));
            return;
        }

        CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
        if (pending == null) {
            log.warn("[MCP] Received response for unknown id: {}", idNode.asInt());
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new CapabilityProviderException(
                    "MCP error " + error.path("code").asInt(-1) + ": "
                            + error.path("message").asText("Unknown MCP error")));
        } else {
            pending.complete(message.get("result"));
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) return;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP] stderr: {}", line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP] Stderr drain ended: {}", e.getMessage());
            }
        }
    }

    List<CapabilityDescriptor> parseToolDescriptors(JsonNode result) {
        if (result == null || !result.path("tools").isArray()) {
            return List.of();
        }
        List<CapabilityDescriptor> descriptors = new ArrayList<>();
        for (JsonNode toolNode : result.get("tools")) {
            String name = toolNode.path("name").asText(null);
            if (name == null) continue;

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP] Failed to parse inputSchema for tool '{}': {}", name, e.getMessage());
                }
            }
            descriptors.add(CapabilityDescriptor.builder()
                    .name(name)
                    .description(toolNode.path("description").asText(""))
                    .inputSchema(inputSchema)
                    .build());
        }
        return descriptors;
    }

    /**
     * First text item wins. JSON objects are returned as-is, other JSON values are
     * wrapped under "result", non-JSON text under "text".
     */
    Map<String, Object> parseToolCallResult(JsonNode result) {
        String text = null;
        JsonNode content = result != null ? result.get("content") : null;
        if (content != null && content.isArray()) {
            for (JsonNode item : content) {
                if ("text".equals(item.path("type").asText("text")) && item.has("text")) {
                    text = item.get("text").asText();
                    break;
                }
            }
        }

        if (text == null) {
            return Map.of(CapabilityInvoker.ERROR_KEY, "No valid response received");
        }
        if (result.path("isError").asBoolean(false)) {
            return Map.of(CapabilityInvoker.ERROR_KEY, text);
        }
        JsonNode parsed = readTreeOrNull(text);
        if (parsed != null && parsed.isObject()) {
            return objectMapper.convertValue(parsed, MAP_TYPE_REF);
        }
        if (parsed != null && parsed.isContainerNode()) {
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("result", objectMapper.convertValue(parsed, Object.class));
            return wrapped;
        }
        return Map.of("text", text);
    }

    private JsonNode readTreeOrNull(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    @Override
    public void close() {
        if (!running && process == null) return;
        log.info("[MCP] Closing provider");
        running = false;

        pendingRequests.values().forEach(f -> f.completeExceptionally(new IOException("MCP provider closed")));
        pendingRequests.clear();

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP] Error closing stdin: {}", e.getMessage());
            }
        }
        if (process != null) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
            process = null;
        }
    }
}
