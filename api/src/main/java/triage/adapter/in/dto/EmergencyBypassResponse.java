package triage.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response body for an emergency bypass request.
 *
 * @param granted whether the bypass was granted
 * @param expiresAt ISO-8601 expiry, absent when not granted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmergencyBypassResponse(boolean granted, String expiresAt) {}
