package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.model.LlmResponse;
import com.deepansh.orchestrator.model.Message;

import java.util.List;

public interface LlmClient {

    /**
     * Send a conversation to the model and return its plain-text reply.
     *
     * @param messages conversation so far (system preamble, history, follow-ups)
     * @param options  per-call temperature / max-token overrides
     * @return the reply; {@link LlmResponse#isEmpty()} when the model produced no content
     */
    LlmResponse chat(List<Message> messages, CompletionOptions options);
}
