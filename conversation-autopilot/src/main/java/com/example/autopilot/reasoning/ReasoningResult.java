package com.example.autopilot.reasoning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw answer of the reasoning collaborator, in its snake_case wire shape. Nothing here is trusted
 * until the decision router has validated it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReasoningResult {

    private String category;
    private Boolean requiresApproval;
    private String intentSummary;
    private String replyIfAccepted;
    private String replyIfDeclined;
    private Boolean meetupConfirmed;
    private String meetupTimeText;
    private String notesForOwner;
}
