package com.example.autopilot.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ActiveItemRequest {

    @NotBlank
    private String itemId;
}
