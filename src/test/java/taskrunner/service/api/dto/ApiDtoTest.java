package taskrunner.service.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import taskrunner.service.model.StatisticsSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON binding of the public request/response records.
 */
class ApiDtoTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void createTaskRequestAcceptsStringMessage() throws Exception {
        CreateTaskRequest request = MAPPER.readValue("{\"message\":\"  hello \",\"extra\":1}",
                CreateTaskRequest.class);

        assertDoesNotThrow(request::validate);
        assertEquals("  hello ", request.text());
    }

    @Test
    void createTaskRequestRejectsMissingBlankOrNonString() throws Exception {
        for (String body : List.of(
                "{}",
                "{\"message\":null}",
                "{\"message\":\"   \"}",
                "{\"message\":42}",
                "{\"message\":true}",
                "{\"message\":{\"text\":\"x\"}}",
                "{\"message\":[\"x\"]}")) {
            CreateTaskRequest request = MAPPER.readValue(body, CreateTaskRequest.class);

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, request::validate, body);
            assertEquals(CreateTaskRequest.INVALID_MESSAGE, e.getMessage());
        }
    }

    @Test
    void createTaskResponseHasOnlyId() throws Exception {
        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(new CreateTaskResponse("abc")));

        assertEquals("abc", json.get("id").asText());
        assertEquals(1, json.size());
    }

    @Test
    void statisticsResponseKeepsFieldOrder() throws Exception {
        StatisticsSnapshot snapshot = new StatisticsSnapshot(4, 2, 3, 1, 0.75, 120, 5, 1, 2);

        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(StatisticsResponse.from(snapshot)));

        List<String> names = new ArrayList<>();
        Iterator<String> it = json.fieldNames();
        it.forEachRemaining(names::add);
        assertEquals(List.of("processedTasks", "retries", "succeeded", "failed", "successRate",
                "averageProcessingTimeMsPerAttempt", "queueLength", "idleWorkers", "busyWorkers"), names);

        assertEquals(4, json.get("processedTasks").asLong());
        assertEquals(0.75, json.get("successRate").asDouble(), 1e-9);
        assertEquals(120, json.get("averageProcessingTimeMsPerAttempt").asLong());
        assertEquals(2, json.get("busyWorkers").asInt());
    }

    @Test
    void unhealthyResponseOmitsPoolFields() throws Exception {
        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(HealthResponse.unhealthy("0h 1m", "1.0.0")));

        assertEquals("unhealthy", json.get("status").asText());
        assertFalse(json.has("poolSize"));
        assertFalse(json.has("queueLength"));
    }
}
