package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds the message list for a single orchestration run.
 *
 * The seed (system preamble, caller history, query) is fixed at construction.
 * Each iteration appends exactly one assistant note and one user follow-up.
 * Discarded when the run ends.
 */
public final class ConversationContext {

    private final List<Message> seed;
    private final List<Message> messages;

    private ConversationContext(List<Message> seed) {
        this.seed = List.copyOf(seed);
        this.messages = new ArrayList<>(seed);
    }

    public static ConversationContext seed(Message systemMessage, List<Message> history, String query) {
        List<Message> seed = new ArrayList<>();
        seed.add(systemMessage);
        if (history != null) {
            seed.addAll(history);
        }
        seed.add(Message.user(query));
        return new ConversationContext(seed);
    }

    public void appendExchange(String assistantNote, String userPrompt) {
        messages.add(Message.assistant(assistantNote));
        messages.add(Message.user(userPrompt));
    }

    /** Snapshot of the current messages; later appends do not show up in it. */
    public List<Message> messages() {
        return List.copyOf(messages);
    }

    /** The messages the context started with, without any iteration exchanges. */
    public List<Message> seedMessages() {
        return seed;
    }

    public int size() {
        return messages.size();
    }
}
