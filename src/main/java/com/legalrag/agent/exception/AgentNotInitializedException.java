package com.legalrag.agent.exception;

public class AgentNotInitializedException extends AgentException {

    public AgentNotInitializedException() {
        super("Agent is not initialized. Call initialize() before query().");
    }
}
