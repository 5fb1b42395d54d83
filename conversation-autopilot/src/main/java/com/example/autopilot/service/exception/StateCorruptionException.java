package com.example.autopilot.service.exception;

import java.util.List;
import org.springframework.http.HttpStatus;

public class StateCorruptionException extends ServiceException {

    private final String conversationId;

    public StateCorruptionException(String conversationId, List<String> violations) {
        this(conversationId, String.join("; ", violations), null);
    }

    public StateCorruptionException(String conversationId, String detail, Throwable cause) {
        super(HttpStatus.CONFLICT,
                "Conversation %s has inconsistent state: %s".formatted(conversationId, detail),
                "state_corruption",
                cause);
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
