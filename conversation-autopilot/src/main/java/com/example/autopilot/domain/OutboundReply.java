package com.example.autopilot.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reply handed to the chat connector. Connectors must treat {@code (conversationId, dedupKey)} as
 * idempotent because delivery is at-least-once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundReply implements Serializable {

    private String conversationId;
    private String dedupKey;
    private String text;
    private Instant requestedAt;
}
