package com.example.autopilot.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single stored chat line. The sequence number is assigned by the conversation store and is
 * strictly increasing within a conversation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message implements Serializable {

    private String conversationId;
    private MessageRole role;
    private String text;
    private String dedupKey;
    private long sequence;
    private Instant timestamp;
}
