package com.example.autopilot.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Decision implements Serializable {

    private String batchId;
    private String conversationId;
    private Classification classification;
    private SensitivityCategory category;
    private String proposedReply;
    private String declineSuggestion;
    private String intentLabel;
    private String ownerNotes;
    private boolean meetupConfirmed;
    private String meetupTimeText;
    private String batchText;
    private Instant decidedAt;

    @JsonIgnore
    public boolean isAuto() {
        return classification == Classification.AUTO;
    }
}
