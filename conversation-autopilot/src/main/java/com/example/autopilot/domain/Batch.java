package com.example.autopilot.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Batch implements Serializable {

    private String id;
    private String conversationId;
    private List<Message> messages;
    private Instant openedAt;
    private Instant lastExtendedAt;
    private boolean closed;
    private Instant closedAt;
    private BatchCloseReason closeReason;

    public int size() {
        return messages == null ? 0 : messages.size();
    }

    public List<String> texts() {
        return messages == null ? List.of() : messages.stream().map(Message::getText).toList();
    }

    public String combinedText() {
        return texts().stream().collect(Collectors.joining("\n"));
    }
}
