package taskrunner.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("poolSize") Integer poolSize,
        @JsonProperty("maxWorkers") Integer maxWorkers,
        @JsonProperty("queueLength") Integer queueLength) {

    public static HealthResponse healthy(String uptime, String version, int poolSize, int maxWorkers,
            int queueLength) {
        return new HealthResponse("healthy", uptime, version, poolSize, maxWorkers, queueLength);
    }

    public static HealthResponse unhealthy(String uptime, String version) {
        return new HealthResponse("unhealthy", uptime, version, null, null, null);
    }
}
