package com.planit.gamification.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AwardXpRequest {

    @Min(value = 1, message = "XP amount must be positive")
    private int amount;

    @NotBlank
    @Size(max = 100)
    private String eventKind;

    @Size(max = 200)
    private String subjectRef;

    @Size(max = 500)
    private String details;

    /**
     * Set when retrying an earlier request whose outcome is unknown.
     */
    @Size(max = 100)
    private String eventId;
}
