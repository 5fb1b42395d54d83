package com.example.autopilot.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AvailabilityRequest {

    @NotNull
    @Size(max = 500)
    private String availabilityNote;
}
