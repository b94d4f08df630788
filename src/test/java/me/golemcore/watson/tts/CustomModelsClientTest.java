package me.golemcore.watson.tts;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.watson.error.WatsonApiException;
import me.golemcore.watson.error.WatsonErrorKind;
import me.golemcore.watson.testsupport.http.OkHttpMockEngine;
import me.golemcore.watson.testsupport.http.WatsonTestClients;
import me.golemcore.watson.tts.model.CustomModel;
import me.golemcore.watson.tts.model.Language;
import me.golemcore.watson.tts.model.Word;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.watson.testsupport.http.WatsonTestClients.BASE_PATH;
import static org.junit.jupiter.api.Assertions.*;

class CustomModelsClientTest {

    private static final String MODEL_JSON = "{\"customization_id\":\"cust-1\",\"name\":\"Names\","
            + "\"language\":\"en-GB\",\"owner\":\"owner-1\",\"created\":\"2024-01-01T00:00:00.000Z\","
            + "\"last_modified\":\"2024-01-02T00:00:00.000Z\",\"description\":\"People\","
            + "\"words\":[{\"word\":\"IEEE\",\"translation\":\"I triple E\"}],\"prompts\":[]}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine httpEngine;
    private CustomModelsClient client;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        client = new CustomModelsClient(WatsonTestClients.executor(httpEngine));
    }

    @Test
    void shouldCreateCustomModel() throws Exception {
        httpEngine.enqueueJson(201, "{\"customization_id\":\"cust-1\"}");

        CustomModel model = client.createCustomModel("Names", Language.EN_GB, null);

        assertEquals("cust-1", model.customizationId());
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals(BASE_PATH + "/v1/customizations", request.target());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("Names", body.get("name").asText());
        assertEquals("en-GB", body.get("language").asText());
        assertFalse(body.has("description"));
    }

    @Test
    void shouldDefaultLanguageOnCreate() throws Exception {
        httpEngine.enqueueJson(200, "{\"customization_id\":\"cust-2\"}");

        client.createCustomModel("Default", null, "desc");

        JsonNode body = objectMapper.readTree(httpEngine.takeRequest().body());
        assertEquals("en-US", body.get("language").asText());
        assertEquals("desc", body.get("description").asText());
    }

    @Test
    void shouldRequireName() {
        assertThrows(IllegalArgumentException.class, () -> client.createCustomModel(" ", Language.EN_US, null));
        assertEquals(0, httpEngine.getRequestCount());
    }

    @Test
    void shouldListCustomModelsByLanguage() {
        httpEngine.enqueueJson(200, "{\"customizations\":[" + MODEL_JSON + "]}");

        List<CustomModel> models = client.listCustomModels(Language.EN_GB);

        assertEquals(1, models.size());
        assertEquals(BASE_PATH + "/v1/customizations?language=en-GB", httpEngine.takeRequest().target());
    }

    @Test
    void shouldListAllCustomModels() {
        httpEngine.enqueueJson(200, "{\"customizations\":[]}");

        assertTrue(client.listCustomModels(null).isEmpty());
        assertEquals(BASE_PATH + "/v1/customizations", httpEngine.takeRequest().target());
    }

    @Test
    void shouldUpdateCustomModel() throws Exception {
        httpEngine.enqueueJson(200, "{}");

        client.updateCustomModel("cust-1", null, "New description",
                List.of(Word.of("NCAA", "N C double A")));

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals(BASE_PATH + "/v1/customizations/cust-1", request.target());
        JsonNode body = objectMapper.readTree(request.body());
        assertFalse(body.has("name"));
        assertEquals("New description", body.get("description").asText());
        assertEquals("NCAA", body.get("words").get(0).get("word").asText());
        assertFalse(body.get("words").get(0).has("part_of_speech"));
    }

    @Test
    void shouldGetCustomModel() {
        httpEngine.enqueueJson(200, MODEL_JSON);

        CustomModel model = client.getCustomModel("cust-1");

        assertEquals("Names", model.name());
        assertEquals("owner-1", model.owner());
        assertEquals("2024-01-02T00:00:00.000Z", model.lastModified());
        assertEquals("I triple E", model.words().get(0).translation());
        assertTrue(model.prompts().isEmpty());
    }

    @Test
    void shouldReportUnauthorizedModelWithId() {
        httpEngine.enqueueJson(401, "{\"code\":401,\"error\":\"Invalid value for 'customization_id'\"}");

        WatsonApiException error = assertThrows(WatsonApiException.class, () -> client.getCustomModel("cust-x"));

        assertEquals(WatsonErrorKind.UNAUTHORIZED, error.getKind());
        assertEquals("cust-x", error.getResourceId());
    }

    @Test
    void shouldDeleteCustomModel() {
        httpEngine.enqueueEmpty(204);

        client.deleteCustomModel("cust-1");

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("DELETE", request.method());
        assertEquals(BASE_PATH + "/v1/customizations/cust-1", request.target());
    }

    @Test
    void deleteShouldTreatOkAsUnmapped() {
        httpEngine.enqueueJson(200, "{}");

        WatsonApiException error = assertThrows(WatsonApiException.class,
                () -> client.deleteCustomModel("cust-1"));

        assertEquals(WatsonErrorKind.UNMAPPED_RESPONSE, error.getKind());
        assertEquals(200, error.getStatusCode());
    }

    @Test
    void createShouldNotDocumentUnauthorized() {
        httpEngine.enqueueEmpty(401);

        WatsonApiException error = assertThrows(WatsonApiException.class,
                () -> client.createCustomModel("Names", Language.EN_US, null));

        assertEquals(WatsonErrorKind.UNMAPPED_RESPONSE, error.getKind());
    }
}
