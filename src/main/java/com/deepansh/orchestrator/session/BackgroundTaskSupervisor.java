package com.deepansh.orchestrator.session;

import com.deepansh.orchestrator.capability.CapabilityInvoker;
import com.deepansh.orchestrator.capability.CapabilityProvider;
import com.deepansh.orchestrator.capability.CapabilityProviderFactory;
import com.deepansh.orchestrator.core.OrchestrationLoop;
import com.deepansh.orchestrator.core.ProgressListener;
import com.deepansh.orchestrator.exception.OrchestrationException;
import com.deepansh.orchestrator.model.OrchestrationRequest;
import com.deepansh.orchestrator.model.OrchestrationResult;
import com.deepansh.orchestrator.model.ProgressStatus;
import com.deepansh.orchestrator.notification.ProgressNotifier;
import com.deepansh.orchestrator.notification.ProgressNotifierFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Runs whole sessions detached from the HTTP request that triggered them.
 *
 * Per-session flow:
 * 1. Create the session's notifier (first, so even a failed provider start is reported)
 * 2. Open the capability provider and build the validated catalog
 * 3. Run the orchestration loop, forwarding its progress as "processing" updates
 * 4. Send exactly one terminal update: "completed" with the answer, or "error"
 * 5. Close provider and notifier on every path
 */
@Service
@Slf4j
public class BackgroundTaskSupervisor {

    static final String STARTED_MESSAGE = "Processing your request...";
    static final String ERROR_MESSAGE_PREFIX = "An error occurred while processing your request: ";

    private final OrchestrationLoop orchestrationLoop;
    private final CapabilityProviderFactory providerFactory;
    private final ProgressNotifierFactory notifierFactory;
    private final TaskExecutor sessionTaskExecutor;

    public BackgroundTaskSupervisor(OrchestrationLoop orchestrationLoop,
                                    CapabilityProviderFactory providerFactory,
                                    ProgressNotifierFactory notifierFactory,
                                    @Qualifier("sessionTaskExecutor") TaskExecutor sessionTaskExecutor) {
        this.orchestrationLoop = orchestrationLoop;
        this.providerFactory = providerFactory;
        this.notifierFactory = notifierFactory;
        this.sessionTaskExecutor = sessionTaskExecutor;
    }

    /**
     * Queue the session and return immediately.
     *
     * @throws OrchestrationException when the session pool is saturated
     */
    public void submit(OrchestrationRequest request) {
        try {
            sessionTaskExecutor.execute(() -> runSession(request));
            log.info("Session queued [sessionId={}]", request.getSessionId());
        } catch (TaskRejectedException e) {
            log.error("Session rejected, executor saturated [sessionId={}]", request.getSessionId());
            throw new OrchestrationException("Too many concurrent sessions, try again later", e);
        }
    }

    /**
     * Full pipeline for one session. Never throws: every failure, {@link Error}s
     * included, becomes the session's single "error" update.
     */
    public void runSession(OrchestrationRequest request) {
        String sessionId = request.getSessionId();
        String callbackUrl = request.getCallbackUrl();
        boolean terminalSent = false;

        try (ProgressNotifier notifier = notifierFactory.create()) {
            try {
                notifier.send(sessionId, callbackUrl, STARTED_MESSAGE, ProgressStatus.PROCESSING, false);

                OrchestrationResult result = runWithProvider(request, event ->
                        notifier.send(sessionId, callbackUrl, event.message(), ProgressStatus.PROCESSING, false));

                terminalSent = true;
                notifier.send(sessionId, callbackUrl, result.getFinalAnswer(), ProgressStatus.COMPLETED, true);
            } catch (Throwable t) {
                log.error("Session failed [sessionId={}]", sessionId, t);
                if (!terminalSent) {
                    terminalSent = true;
                    sendErrorTerminal(notifier, sessionId, callbackUrl, t);
                }
            }
        } catch (RuntimeException e) {
            log.error("Notifier unavailable [sessionId={}]", sessionId, e);
        }

        log.info("Session finished [sessionId={}, terminalSent={}]", sessionId, terminalSent);
    }

    /**
     * The interrupt flag is cleared for the send, since a pooled connection lease
     * fails at once on an interrupted thread, and restored afterwards.
     */
    private static void sendErrorTerminal(ProgressNotifier notifier, String sessionId,
                                          String callbackUrl, Throwable failure) {
        String detail = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        boolean interrupted = Thread.interrupted();
        try {
            notifier.send(sessionId, callbackUrl, ERROR_MESSAGE_PREFIX + detail, ProgressStatus.ERROR, true);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Runs the loop in the caller's thread with no progress updates.
     */
    public OrchestrationResult runSynchronously(OrchestrationRequest request) {
        return runWithProvider(request, ProgressListener.NONE);
    }

    private OrchestrationResult runWithProvider(OrchestrationRequest request, ProgressListener listener) {
        try (CapabilityProvider provider = providerFactory.open()) {
            CapabilityInvoker invoker = providerFactory.invokerFor(providerFactory.catalogFor(provider));
            return orchestrationLoop.run(request, invoker, listener);
        }
    }
}
