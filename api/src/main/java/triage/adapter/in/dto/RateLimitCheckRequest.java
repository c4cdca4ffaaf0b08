package triage.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request body for a rate limit check.
 *
 * <p>{@code role} and {@code operation} are matched leniently; unrecognized values are limited
 * by the global default limit.
 */
public record RateLimitCheckRequest(
        @NotBlank(message = "subject_id is required") String subjectId,
        @Size(max = 64, message = "role must be at most 64 characters")
                @Pattern(regexp = "[\\w .-]*", message = "role contains invalid characters")
                String role,
        @Size(max = 64, message = "operation must be at most 64 characters")
                @Pattern(regexp = "[\\w .-]*", message = "operation contains invalid characters")
                String operation,
        Boolean emergency) {

    public boolean isEmergency() {
        return Boolean.TRUE.equals(emergency);
    }
}
