package com.example.autopilot.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ApprovalDecisionRequest {

    /**
     * Replaces the suggested reply when approving; ignored on rejection.
     */
    @Size(max = 2000)
    private String replyText;
}
