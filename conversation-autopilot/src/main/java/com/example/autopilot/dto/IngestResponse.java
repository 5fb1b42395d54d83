package com.example.autopilot.dto;

import com.example.autopilot.service.IngestResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IngestResponse {
    String conversationId;
    IngestResult result;
}
