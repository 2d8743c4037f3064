package com.rsfleet.repairs.api.dto;

import java.util.UUID;

/**
 * Request body for POST /repairs/{id}/assignment. The assigning manager is
 * the acting technician from the request headers.
 */
public record AssignmentRequest(UUID technicianId) {
}
