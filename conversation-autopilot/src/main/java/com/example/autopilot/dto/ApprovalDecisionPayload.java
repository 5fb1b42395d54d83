package com.example.autopilot.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Socket event sent by the approval console; {@code outcome} is {@code approve} or {@code reject}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalDecisionPayload {

    private String token;

    private String outcome;

    private String replyText;
}
