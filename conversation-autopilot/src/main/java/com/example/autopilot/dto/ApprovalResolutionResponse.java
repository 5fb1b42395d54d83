package com.example.autopilot.dto;

import com.example.autopilot.domain.ApprovalStatus;
import com.example.autopilot.service.ResolutionResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ApprovalResolutionResponse {
    String token;
    ResolutionResult result;
    ApprovalStatus status;
}
