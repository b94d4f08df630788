package me.golemcore.watson.tts;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.watson.auth.BearerTokenSource;
import me.golemcore.watson.error.WatsonApiException;
import me.golemcore.watson.error.WatsonErrorKind;
import me.golemcore.watson.http.ServiceEndpoint;
import me.golemcore.watson.testsupport.http.OkHttpMockEngine;
import me.golemcore.watson.tts.model.AudioEncoding;
import me.golemcore.watson.tts.model.AudioFormat;
import me.golemcore.watson.tts.model.Voice;
import me.golemcore.watson.tts.model.WatsonVoice;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TextToSpeechTest {

    private static final String BASE_URL = "https://api.eu-de.text-to-speech.watson.cloud.ibm.com/instances/guid";
    private static final String TOKEN = "iam-token";

    private OkHttpMockEngine httpEngine;
    private BearerTokenSource tokenSource;
    private TextToSpeech textToSpeech;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(1, TimeUnit.SECONDS)
                .addInterceptor(httpEngine)
                .build();
        tokenSource = mock(BearerTokenSource.class);
        when(tokenSource.bearerToken()).thenReturn(TOKEN);
        textToSpeech = new TextToSpeech(client, new ObjectMapper(), ServiceEndpoint.of(BASE_URL), tokenSource);
    }

    @Test
    void shouldListVoices() {
        httpEngine.enqueueJson(200, "{\"voices\":[{\"url\":\"" + BASE_URL + "/v1/voices/en-US_MichaelV3Voice\","
                + "\"gender\":\"male\",\"name\":\"en-US_MichaelV3Voice\",\"language\":\"en-US\","
                + "\"description\":\"Michael: American English male voice.\",\"customizable\":true,"
                + "\"supported_features\":{\"custom_pronunciation\":true,\"voice_transformation\":false}}]}");

        List<Voice> voices = textToSpeech.listVoices();

        assertEquals(1, voices.size());
        Voice voice = voices.get(0);
        assertEquals("en-US_MichaelV3Voice", voice.name());
        assertEquals("male", voice.gender());
        assertTrue(voice.customizable());
        assertTrue(voice.supportedFeatures().customPronunciation());
        assertFalse(voice.supportedFeatures().voiceTransformation());
        assertNull(voice.customization());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/instances/guid/v1/voices", request.target());
        assertEquals("Bearer " + TOKEN, request.headers().get("Authorization"));
    }

    @Test
    void shouldSynthesizeWithDefaultVoice() {
        byte[] audio = { 79, 103, 103, 83 };
        httpEngine.enqueueBytes(200, audio, "audio/ogg;codecs=opus");

        byte[] result = textToSpeech.synthesize("Hello world");

        assertArrayEquals(audio, result);
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("/instances/guid/v1/synthesize?text=Hello%20world&voice=en-US_MichaelV3Voice",
                request.target());
    }

    @Test
    void shouldUseChangedDefaultVoice() {
        httpEngine.enqueueBytes(200, new byte[] { 1 }, "audio/wav");
        textToSpeech.setDefaultVoice(WatsonVoice.DE_DE_BIRGIT_V3);

        textToSpeech.synthesize("Hallo", AudioFormat.of(AudioEncoding.WAV), "cust-1");

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("de-DE_BirgitV3Voice", request.url().queryParameter("voice"));
        assertEquals("audio/wav;rate=22050", request.url().queryParameter("accept"));
        assertEquals("cust-1", request.url().queryParameter("customization_id"));
        assertEquals(WatsonVoice.DE_DE_BIRGIT_V3, textToSpeech.getDefaultVoice());
    }

    @Test
    void shouldRejectNullDefaultVoice() {
        assertThrows(IllegalArgumentException.class, () -> textToSpeech.setDefaultVoice(null));
        assertEquals(WatsonVoice.DEFAULT, textToSpeech.getDefaultVoice());
    }

    @Test
    void shouldReportServiceUnavailable() {
        httpEngine.enqueueJson(503, "{\"code\":503,\"error\":\"Service Unavailable\"}");

        WatsonApiException error = assertThrows(WatsonApiException.class, () -> textToSpeech.listVoices());

        assertEquals(WatsonErrorKind.SERVICE_UNAVAILABLE, error.getKind());
        assertEquals("Service Unavailable", error.getServiceMessage());
    }

    @Test
    void shouldReportUnexpectedStatusAsUnmapped() {
        httpEngine.enqueueEmpty(418);

        WatsonApiException error = assertThrows(WatsonApiException.class, () -> textToSpeech.listVoices());

        assertEquals(WatsonErrorKind.UNMAPPED_RESPONSE, error.getKind());
        assertEquals(418, error.getStatusCode());
    }

    @Test
    void shouldAskTokenSourceOnEveryCall() {
        httpEngine.enqueueJson(200, "{\"voices\":[]}");
        httpEngine.enqueueJson(200, "{\"voices\":[]}");

        textToSpeech.listVoices();
        textToSpeech.voices().listVoices();

        verify(tokenSource, times(2)).bearerToken();
    }

    @Test
    void shouldShareEndpointAcrossClients() {
        assertEquals(BASE_URL, textToSpeech.getEndpoint().baseUrl().toString());
        assertNotNull(textToSpeech.customModels());
        assertNotNull(textToSpeech.words());
        assertNotNull(textToSpeech.prompts());
        assertNotNull(textToSpeech.speakers());
        assertNotNull(textToSpeech.pronunciation());
        assertNotNull(textToSpeech.synthesis());
        assertNotNull(textToSpeech.userData());
    }
}
