package com.legalrag.agent.core;

/**
 * States of the retrieval state machine. Execution always starts at
 * {@link #DECIDE_ACTION} and stops at {@link #END}.
 */
public enum AgentNode {
    DECIDE_ACTION,
    REFINE_QUERY,
    SEARCH,
    SEARCH_WEB,
    GENERATE_ANSWER,
    END
}
