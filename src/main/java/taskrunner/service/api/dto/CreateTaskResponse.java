package taskrunner.service.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a submitted task.
 * POST /tasks -> 201
 */
public record CreateTaskResponse(
        @JsonProperty("id") String id) {
}
