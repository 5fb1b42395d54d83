package com.example.autopilot.dto;

import com.example.autopilot.domain.InboundMessage;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import lombok.Data;

/**
 * Message received from the chat connector, either over HTTP or from the inbound topic.
 */
@Data
public class InboundMessagePayload {

    @JsonAlias("chatId")
    @Size(max = InboundMessage.MAX_KEY_LENGTH)
    private String conversationId;

    @JsonAlias({"buyerName", "name"})
    @Size(max = 255)
    private String displayName;

    @JsonAlias("url")
    @Size(max = 1024)
    private String threadUrl;

    @Size(max = InboundMessage.MAX_KEY_LENGTH)
    private String messageId;

    @NotBlank
    @Size(max = 4000)
    private String text;

    private Instant sentAt;

    public InboundMessage toInboundMessage() {
        return InboundMessage.builder()
                .conversationId(conversationId)
                .displayName(displayName)
                .threadUrl(threadUrl)
                .messageId(messageId)
                .text(text)
                .sentAt(sentAt)
                .build();
    }
}
