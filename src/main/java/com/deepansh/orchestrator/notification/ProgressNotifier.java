package com.deepansh.orchestrator.notification;

import com.deepansh.orchestrator.model.ProgressStatus;
import com.deepansh.orchestrator.model.SessionProgress;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.http.MediaType;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;

/**
 * Posts {@link SessionProgress} updates to a session's callback URL.
 *
 * Owned by exactly one session: the HTTP channel is created on the first send,
 * reused for every later one and released by {@link #close()}. Sending never
 * throws; anything short of a 2xx reply is reported as {@code false}.
 * There is no retry, a dropped update stays dropped.
 */
@Slf4j
public class ProgressNotifier implements AutoCloseable {

    private final ObjectMapper objectMapper;
    private final Timeout timeout;

    private CloseableHttpClient httpClient;
    private RestClient restClient;
    private boolean closed;

    public ProgressNotifier(ObjectMapper objectMapper, Duration timeout) {
        this.objectMapper = objectMapper;
        this.timeout = Timeout.ofMilliseconds(timeout.toMillis());
    }

    /**
     * @return true when the receiver answered with a 2xx status
     */
    public boolean send(String sessionId,
                        String callbackUrl,
                        String message,
                        ProgressStatus status,
                        boolean complete) {
        if (closed) {
            log.warn("Notifier already closed, dropping {} update [sessionId={}]", status.wireValue(), sessionId);
            return false;
        }
        if (callbackUrl == null || callbackUrl.isBlank()) {
            log.debug("No callback URL, skipping {} update [sessionId={}]", status.wireValue(), sessionId);
            return false;
        }

        SessionProgress payload = SessionProgress.builder()
                .sessionId(sessionId)
                .partialMessage(message)
                .status(status)
                .complete(complete)
                .build();

        try {
            String body = objectMapper.writeValueAsString(payload);
            channel().post()
                    .uri(callbackUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();

            log.info("Notification delivered [sessionId={}, status={}, isComplete={}]",
                    sessionId, status.wireValue(), complete);
            return true;
        } catch (JsonProcessingException e) {
            log.error("Could not serialise notification [sessionId={}]: {}", sessionId, e.getOriginalMessage());
            return false;
        } catch (RuntimeException e) {
            // RestClientException for timeouts, refused connections and non-2xx replies,
            // IllegalArgumentException for a malformed callback URL
            log.warn("Notification not delivered [sessionId={}, status={}, url={}]: {}",
                    sessionId, status.wireValue(), callbackUrl, e.getMessage());
            return false;
        }
    }

    public boolean isOpen() {
        return !closed;
    }

    /** True once the first send has created the HTTP channel and it has not been closed. */
    public boolean hasChannel() {
        return httpClient != null;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (httpClient == null) return;
        try {
            httpClient.close();
        } catch (IOException e) {
            log.warn("Error closing notifier channel: {}", e.getMessage());
        } finally {
            httpClient = null;
            restClient = null;
        }
    }

    private RestClient channel() {
        if (restClient == null) {
            httpClient = HttpClients.custom()
                    .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                            .setMaxConnPerRoute(2)
                            .setDefaultConnectionConfig(ConnectionConfig.custom()
                                    .setConnectTimeout(timeout)
                                    .setSocketTimeout(timeout)
                                    .build())
                            .build())
                    .setDefaultRequestConfig(RequestConfig.custom()
                            .setResponseTimeout(timeout)
                            .build())
                    .build();
            restClient = RestClient.builder()
                    .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient))
                    .build();
        }
        return restClient;
    }
}
