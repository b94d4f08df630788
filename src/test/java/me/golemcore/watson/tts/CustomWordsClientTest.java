package me.golemcore.watson.tts;

import me.golemcore.watson.error.WatsonApiException;
import me.golemcore.watson.error.WatsonErrorKind;
import me.golemcore.watson.testsupport.http.OkHttpMockEngine;
import me.golemcore.watson.testsupport.http.WatsonTestClients;
import me.golemcore.watson.tts.model.Word;
import me.golemcore.watson.tts.model.WordTranslation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.watson.testsupport.http.WatsonTestClients.BASE_PATH;
import static org.junit.jupiter.api.Assertions.*;

class CustomWordsClientTest {

    private OkHttpMockEngine httpEngine;
    private CustomWordsClient client;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        client = new CustomWordsClient(WatsonTestClients.executor(httpEngine));
    }

    @Test
    void shouldAddWordsInOneCall() {
        httpEngine.enqueueJson(200, "{}");

        client.addCustomWords("cust-1", List.of(Word.of("IEEE", "I triple E"),
                new Word("hello", "h@loU", "Mesi")));

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals(BASE_PATH + "/v1/customizations/cust-1/words", request.target());
        assertEquals("{\"words\":[{\"word\":\"IEEE\",\"translation\":\"I triple E\"},"
                + "{\"word\":\"hello\",\"translation\":\"h@loU\",\"part_of_speech\":\"Mesi\"}]}", request.body());
    }

    @Test
    void shouldRejectEmptyWordList() {
        assertThrows(IllegalArgumentException.class, () -> client.addCustomWords("cust-1", List.of()));
        assertEquals(0, httpEngine.getRequestCount());
    }

    @Test
    void shouldListWords() {
        httpEngine.enqueueJson(200, "{\"words\":[{\"word\":\"IEEE\",\"translation\":\"I triple E\"}]}");

        List<Word> words = client.listCustomWords("cust-1");

        assertEquals(List.of(new Word("IEEE", "I triple E", null)), words);
    }

    @Test
    void shouldPutSingleWordWithEncodedPath() {
        httpEngine.enqueueJson(200, "{}");

        client.addCustomWord("cust-1", "AT&T / Co", WordTranslation.of("A T and T"));

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("PUT", request.method());
        assertEquals(BASE_PATH + "/v1/customizations/cust-1/words/AT&T%20%2F%20Co", request.target());
        assertEquals("{\"translation\":\"A T and T\"}", request.body());
    }

    @Test
    void shouldGetWordTranslation() {
        httpEngine.enqueueJson(200, "{\"translation\":\"I triple E\",\"part_of_speech\":\"Mesi\"}");

        WordTranslation translation = client.getCustomWord("cust-1", "IEEE");

        assertEquals("I triple E", translation.translation());
        assertEquals("Mesi", translation.partOfSpeech());
        assertEquals(BASE_PATH + "/v1/customizations/cust-1/words/IEEE", httpEngine.takeRequest().target());
    }

    @Test
    void shouldDeleteWord() {
        httpEngine.enqueueEmpty(204);

        client.deleteCustomWord("cust-1", "IEEE");

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("DELETE", request.method());
        assertEquals(BASE_PATH + "/v1/customizations/cust-1/words/IEEE", request.target());
    }

    @Test
    void shouldReportBadRequestForWord() {
        httpEngine.enqueueJson(400, "{\"code\":400,\"error\":\"Invalid translation\"}");

        WatsonApiException error = assertThrows(WatsonApiException.class,
                () -> client.addCustomWord("cust-1", "IEEE", WordTranslation.of("!!")));

        assertEquals(WatsonErrorKind.BAD_REQUEST, error.getKind());
        assertEquals("Invalid translation", error.getServiceMessage());
        assertEquals("cust-1", error.getResourceId());
    }

    @Test
    void shouldNotDeleteWholeModelForDotDotWord() {
        assertThrows(IllegalArgumentException.class, () -> client.deleteCustomWord("cust-1", ".."));
        assertEquals(0, httpEngine.getRequestCount());
    }
}
