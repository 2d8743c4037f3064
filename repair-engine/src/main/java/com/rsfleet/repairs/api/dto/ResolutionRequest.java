package com.rsfleet.repairs.api.dto;

/**
 * Request body for POST /repairs/{id}/resolution.
 *
 * Required: approved
 * Optional: decidedBy (name shown on the approval record), notes
 */
public record ResolutionRequest(boolean approved, String decidedBy, String notes) {
}
