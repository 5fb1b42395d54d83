package com.example.autopilot.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage implements Serializable {

    /**
     * Longest conversation id or message id the stores accept.
     */
    public static final int MAX_KEY_LENGTH = 128;

    private String conversationId;
    private String displayName;
    private String threadUrl;
    private String messageId;
    private String text;
    private Instant sentAt;
}
