package com.wpanther.fpolifecycle.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionRequest {
    @Size(max = 2000, message = "Reason must be at most 2000 characters")
    private String reason;
}
