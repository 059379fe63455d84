package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.ToolInvocationRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls tool requests out of free-form model text.
 *
 * The model is told to answer with
 * <pre>
 * { "tool_request": { "tool_name": "...", "arguments": { ... } }, "reason": "..." }
 * </pre>
 * but in practice wraps it in fenced blocks, emits several in a row, or surrounds it
 * with prose. Three strategies are tried in order and the first one that yields
 * anything wins:
 * <ol>
 * <li>every {@code ```json} fenced block, parsed independently
 * <li>every complete top-level {@code {...}} object found by brace matching
 * <li>one object spanning the first '{' to the last '}'
 * </ol>
 * Malformed candidates are skipped. Order of appearance is preserved.
 */
@Component
@Slf4j
public class ToolRequestExtractor {

    public static final String REQUEST_FIELD = "tool_request";
    public static final String NAME_FIELD = "tool_name";
    public static final String ARGUMENTS_FIELD = "arguments";

    private static final String FENCE = "```";
    private static final String JSON_FENCE = "```json";

    // Models copy the "// ..." comments and trailing commas from the format example.
    private final ObjectMapper lenientMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .build();

    /**
     * Cheap pre-check: the marker plus balanced braces, or a json fenced block.
     */
    public boolean looksLikeToolRequest(String text) {
        if (text == null || text.isBlank()) return false;
        if (text.toLowerCase(Locale.ROOT).contains(JSON_FENCE)) return true;
        return text.contains(REQUEST_FIELD) && hasBalancedBraces(text);
    }

    public List<ToolInvocationRequest> extract(String text) {
        if (text == null || text.isBlank()) return List.of();

        List<ToolInvocationRequest> requests = fromFencedBlocks(text);
        if (requests.isEmpty()) {
            requests = fromTopLevelObjects(text);
        }
        if (requests.isEmpty()) {
            requests = fromOuterBraces(text);
        }

        log.debug("Extracted {} tool request(s): {}", requests.size(),
                requests.stream().map(ToolInvocationRequest::name).toList());
        return requests;
    }

    List<ToolInvocationRequest> fromFencedBlocks(String text) {
        List<ToolInvocationRequest> requests = new ArrayList<>();
        StringBuilder block = null;

        for (String line : text.split("\n", -1)) {
            if (block == null) {
                if (line.toLowerCase(Locale.ROOT).contains(JSON_FENCE)) {
                    block = new StringBuilder();
                }
            } else if (line.contains(FENCE)) {
                parseCandidate(block.toString()).ifPresent(requests::add);
                block = null;
            } else {
                block.append(line).append('\n');
            }
        }
        return requests;
    }

    List<ToolInvocationRequest> fromTopLevelObjects(String text) {
        List<ToolInvocationRequest> requests = new ArrayList<>();
        int depth = 0;
        int start = -1;
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"' && depth > 0) {
                inString = true;
            } else if (c == '{') {
                if (depth == 0) start = i;
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0) {
                    parseCandidate(text.substring(start, i + 1)).ifPresent(requests::add);
                }
            }
        }
        return requests;
    }

    List<ToolInvocationRequest> fromOuterBraces(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) return List.of();
        return parseCandidate(text.substring(start, end + 1)).map(List::of).orElse(List.of());
    }

    @SuppressWarnings("unchecked")
    private Optional<ToolInvocationRequest> parseCandidate(String json) {
        if (json.isBlank()) return Optional.empty();

        Map<String, Object> parsed;
        try {
            Object value = lenientMapper.readValue(json.strip(), Object.class);
            if (!(value instanceof Map<?, ?>)) return Optional.empty();
            parsed = (Map<String, Object>) value;
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed tool request candidate: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        if (!(parsed.get(REQUEST_FIELD) instanceof Map<?, ?> request)) {
            return Optional.empty();
        }
        if (!(request.get(NAME_FIELD) instanceof String name) || name.isBlank()) {
            return Optional.empty();
        }

        Map<String, Object> arguments = request.get(ARGUMENTS_FIELD) instanceof Map<?, ?> args
                ? (Map<String, Object>) args
                : Map.of();
        return Optional.of(ToolInvocationRequest.of(name.strip(), arguments));
    }

    /**
     * True when at least one brace pair exists and every '{' outside string literals is closed.
     */
    static boolean hasBalancedBraces(String text) {
        int depth = 0;
        boolean sawPair = false;
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"' && depth > 0) {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) return false;
                depth--;
                sawPair = true;
            }
        }
        return sawPair && depth == 0;
    }
}
