package com.legalrag.agent.exception;

/**
 * Unrecoverable agent failure: misconfiguration, a broken provider contract,
 * or calling the agent before it is initialized.
 *
 * Inside the retrieval loop every node catches external-service failures,
 * this type included, and turns them into a safe transition.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
