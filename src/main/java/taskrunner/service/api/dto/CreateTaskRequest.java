package taskrunner.service.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for submitting a task.
 * POST /tasks
 *
 * The message is bound as a raw JSON value so that numbers or booleans are rejected
 * instead of being coerced to strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateTaskRequest(
        @JsonProperty("message") Object message) {

    public static final String INVALID_MESSAGE = "message is required and must be a string";

    /** Validate the request */
    public void validate() {
        if (!(message instanceof String text) || text.trim().isEmpty()) {
            throw new IllegalArgumentException(INVALID_MESSAGE);
        }
    }

    /** The message as submitted (untrimmed). Call {@link #validate()} first. */
    public String text() {
        return (String) message;
    }
}
