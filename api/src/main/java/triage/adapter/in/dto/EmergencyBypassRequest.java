package triage.adapter.in.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request body for an explicit emergency bypass.
 */
public record EmergencyBypassRequest(
        @NotBlank(message = "subject_id is required") String subjectId,
        @NotBlank(message = "role is required")
                @Size(max = 64, message = "role must be at most 64 characters")
                @Pattern(regexp = "[\\w .-]*", message = "role contains invalid characters")
                String role,
        @Min(value = 1, message = "duration_minutes must be positive") Long durationMinutes,
        String reason) {}
