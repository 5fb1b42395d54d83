package com.example.autopilot.service;

import com.example.autopilot.domain.ListingProfile;
import com.example.autopilot.domain.Message;
import java.time.ZonedDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * What the router knows about a conversation besides the batch itself.
 */
@Value
@Builder
public class ConversationContext {

    String conversationId;
    String displayName;
    List<Message> history;
    ListingProfile listing;
    ZonedDateTime localTime;
}
