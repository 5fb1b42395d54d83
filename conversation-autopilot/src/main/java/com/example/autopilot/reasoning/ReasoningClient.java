package com.example.autopilot.reasoning;

/**
 * Language-model collaborator that reads a conversation and proposes how to answer its latest
 * batch.
 */
public interface ReasoningClient {

    /**
     * @throws com.example.autopilot.service.exception.ReasoningException when no usable answer
     *         could be obtained
     */
    ReasoningResult analyze(ReasoningRequest request);
}
