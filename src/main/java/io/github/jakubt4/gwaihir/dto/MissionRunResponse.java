package io.github.jakubt4.gwaihir.dto;

/**
 * Response returned after a run submission.
 *
 * @param runId   id of the queued run ({@code null} on rejection)
 * @param status  {@code "QUEUED"} or {@code "REJECTED"}
 * @param message human-readable detail about the result
 */
public record MissionRunResponse(String runId, String status, String message) {
}
