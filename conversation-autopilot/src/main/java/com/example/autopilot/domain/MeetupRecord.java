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
public class MeetupRecord implements Serializable {

    private Long id;
    private String conversationId;
    private String displayName;
    private String itemName;
    private String location;
    private String meetupTimeText;
    private String notes;
    private Instant loggedAt;
}
