package com.deepansh.orchestrator.model;

public enum TerminationReason {
    /** First reply carried no tool request. */
    DIRECT_ANSWER,
    /** Model emitted the sentinel token. */
    SENTINEL,
    /** Model stopped asking for tools without the sentinel. */
    NO_MORE_REQUESTS,
    BUDGET_EXHAUSTED,
    /** Model kept returning nothing, even after the simplified retry. */
    MODEL_UNAVAILABLE
}
