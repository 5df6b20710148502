package taskrunner.service.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import taskrunner.service.model.StatisticsSnapshot;

/**
 * Response DTO for aggregate processing statistics.
 * GET /statistics
 */
@JsonPropertyOrder({
        "processedTasks", "retries", "succeeded", "failed", "successRate",
        "averageProcessingTimeMsPerAttempt", "queueLength", "idleWorkers", "busyWorkers" })
public record StatisticsResponse(
        @JsonProperty("processedTasks") long processedTasks,
        @JsonProperty("retries") long retries,
        @JsonProperty("succeeded") long succeeded,
        @JsonProperty("failed") long failed,
        @JsonProperty("successRate") double successRate,
        @JsonProperty("averageProcessingTimeMsPerAttempt") long averageProcessingTimeMsPerAttempt,
        @JsonProperty("queueLength") int queueLength,
        @JsonProperty("idleWorkers") int idleWorkers,
        @JsonProperty("busyWorkers") int busyWorkers) {

    /** Create response from domain model */
    public static StatisticsResponse from(StatisticsSnapshot snapshot) {
        return new StatisticsResponse(
                snapshot.processedTasks(),
                snapshot.retries(),
                snapshot.succeeded(),
                snapshot.failed(),
                snapshot.successRate(),
                snapshot.averageProcessingTimeMsPerAttempt(),
                snapshot.queueLength(),
                snapshot.idleWorkers(),
                snapshot.busyWorkers());
    }
}
