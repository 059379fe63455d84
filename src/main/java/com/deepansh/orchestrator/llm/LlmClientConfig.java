package com.deepansh.orchestrator.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Factory that creates the active LLM client based on the LLM_PROVIDER env var.
 * The same client serves both the primary loop calls and the result classifier.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:deepseek}")
    private String provider;

    // DeepSeek
    @Value("${deepseek.api-key:}") private String deepSeekKey;
    @Value("${deepseek.base-url}") private String deepSeekBaseUrl;
    @Value("${deepseek.model}")    private String deepSeekModel;
    @Value("${deepseek.max-tokens}") private int deepSeekMaxTokens;
    @Value("${deepseek.temperature}") private double deepSeekTemp;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;
    @Value("${openai.temperature}") private double openAiTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeModel());
        log.info("================================================================");
    }

    /**
     * The raw client, selected by LLM_PROVIDER.
     * Wrapped by ResilientLlmClient with retry + circuit breaker.
     */
    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(@Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        if ("openai".equalsIgnoreCase(provider)) {
            logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
            return new GenericLlmClient(openAiProps(), "openai", builder.clone());
        }
        logKey("DEEPSEEK", deepSeekKey, "DEEPSEEK_API_KEY");
        return new GenericLlmClient(deepSeekProps(), "deepseek", builder.clone());
    }

    private LlmProviderProperties deepSeekProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(deepSeekKey); p.setBaseUrl(deepSeekBaseUrl); p.setModel(deepSeekModel);
        p.setMaxTokens(deepSeekMaxTokens); p.setTemperature(deepSeekTemp);
        return p;
    }

    private LlmProviderProperties openAiProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(openAiKey); p.setBaseUrl(openAiBaseUrl); p.setModel(openAiModel);
        p.setMaxTokens(openAiMaxTokens); p.setTemperature(openAiTemp);
        return p;
    }

    private String activeModel() {
        return "openai".equalsIgnoreCase(provider) ? openAiModel : deepSeekModel;
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", name, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
