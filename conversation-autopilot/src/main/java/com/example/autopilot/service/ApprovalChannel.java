package com.example.autopilot.service;

import com.example.autopilot.domain.ApprovalRequest;

/**
 * Puts an approval request in front of a human. Answers come back through
 * {@link ApprovalBroker#resolve}.
 */
public interface ApprovalChannel {

    void present(ApprovalRequest request);
}
