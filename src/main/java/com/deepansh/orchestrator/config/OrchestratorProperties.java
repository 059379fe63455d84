package com.deepansh.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Strongly-typed configuration for the orchestration loop and its collaborators.
 * Bound from application.yml under the "orchestrator" prefix.
 */
@ConfigurationProperties(prefix = "orchestrator")
@Validated
@Data
public class OrchestratorProperties {

    @Valid
    private Loop loop = new Loop();
    private Evidence evidence = new Evidence();
    private Classifier classifier = new Classifier();
    private Notifier notifier = new Notifier();
    private Capabilities capabilities = new Capabilities();

    /** Persona text per user role, prepended to the capability preamble. Keys are lower-case roles. */
    private Map<String, String> personas = new HashMap<>();

    public String personaFor(String role) {
        if (role == null || role.isBlank()) return null;
        return personas.get(role.trim().toLowerCase(Locale.ROOT));
    }

    @Data
    public static class Loop {
        public static final int ITERATION_CEILING = 10;

        /** May be lowered, never raised above the ceiling; binding fails otherwise. */
        @Min(1)
        @Max(ITERATION_CEILING)
        private int maxIterations = ITERATION_CEILING;
        private int resultSizeCap = 5000;
        private Duration interIterationDelay = Duration.ofSeconds(2);
        private String sentinel = "LISTO";

        /** Max tokens of the follow-up reply, one per follow-up branch. */
        private int correctiveMaxTokens = 700;
        private int allSucceededMaxTokens = 500;
        private int allFailedMaxTokens = 600;

        private double simplifiedRetryTemperature = 0.3;
        private int simplifiedRetryMaxTokens = 300;

        private int finalAnswerMaxTokens = 1500;
    }

    @Data
    public static class Evidence {
        private int maxSuccesses = 3;
        private int successPreviewChars = 1000;
        private int maxFailures = 2;
        private int failurePreviewChars = 500;
    }

    @Data
    public static class Classifier {
        private double temperature = 0.1;
        private int maxTokens = 10;
        private int resultPreviewChars = 1000;
    }

    @Data
    public static class Notifier {
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Capabilities {
        /** Allowlist of capability names. Empty means every capability the provider offers. */
        private List<String> allowed = new ArrayList<>();
        private Mcp mcp = new Mcp();

        @Data
        public static class Mcp {
            /** Shell command launching an MCP server over stdio. Blank selects the local provider. */
            private String command = "";
            private Map<String, String> env = new HashMap<>();
            private int startupTimeoutSeconds = 30;
            private int requestTimeoutSeconds = 60;

            public boolean isConfigured() {
                return command != null && !command.isBlank();
            }
        }
    }
}
