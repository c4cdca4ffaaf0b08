package triage.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response body for a policy reload.
 *
 * @param policyVersion version now in effect
 * @param source origin of the policy now in effect
 * @param error load error, absent when the document loaded cleanly
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyReloadResponse(String policyVersion, String source, String error) {}
