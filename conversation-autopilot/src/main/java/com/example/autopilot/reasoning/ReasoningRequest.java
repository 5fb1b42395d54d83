package com.example.autopilot.reasoning;

import com.example.autopilot.domain.ListingProfile;
import com.example.autopilot.domain.Message;
import java.time.ZonedDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReasoningRequest {

    String conversationId;
    String displayName;
    List<Message> history;
    List<String> batchMessages;
    ListingProfile listing;
    ZonedDateTime localTime;
}
