package taskrunner.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskrunner.service.api.Controller.ControllerResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControllerResponseTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void errorBodiesAreValidJson() throws Exception {
        ControllerResponse response = ControllerResponse.badRequest("field \"message\" is required\n");

        assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        JsonNode json = MAPPER.readTree(response.body());
        assertEquals("field \"message\" is required\n", json.get("error").asText());
        assertEquals(1, json.size());
    }

    @Test
    void statusPerFactory() {
        assertEquals(HttpResponseStatus.OK, ControllerResponse.json("{}").status());
        assertEquals(HttpResponseStatus.CREATED, ControllerResponse.json(HttpResponseStatus.CREATED, "{}").status());
        assertEquals(HttpResponseStatus.NOT_FOUND, ControllerResponse.notFound("x").status());
        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, ControllerResponse.error("x").status());
        assertEquals(HttpResponseStatus.SERVICE_UNAVAILABLE, ControllerResponse.unavailable("x").status());
        assertEquals("{\"error\":\"\"}", ControllerResponse.error(null).body());
    }
}
