package com.example.autopilot.service;

import com.example.autopilot.domain.OutboundReply;

/**
 * Hands a reply to the chat connector.
 */
public interface OutboundReplySink {

    /**
     * @throws com.example.autopilot.service.exception.ReplyDeliveryException when the connector
     *         did not accept the reply
     */
    void deliver(OutboundReply reply);
}
