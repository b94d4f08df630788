package me.golemcore.watson.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.watson.auth.BearerTokenSource;
import me.golemcore.watson.error.WatsonApiException;
import me.golemcore.watson.error.WatsonConnectionException;
import me.golemcore.watson.error.WatsonErrorKind;
import me.golemcore.watson.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WatsonHttpExecutorTest {

    private static final String BASE_URL = "https://api.test.watson.cloud.ibm.com/instances/abc";
    private static final String TOKEN = "test-token";

    private OkHttpMockEngine httpEngine;
    private WatsonHttpExecutor executor;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(1, TimeUnit.SECONDS)
                .readTimeout(1, TimeUnit.SECONDS)
                .addInterceptor(httpEngine)
                .build();
        executor = new WatsonHttpExecutor(client, new ObjectMapper(), ServiceEndpoint.of(BASE_URL),
                BearerTokenSource.of(TOKEN));
    }

    private static ApiOperation.Builder<Map<String, Object>> getThing() {
        return ApiOperation.builder(HttpMethod.GET, "v1/things/{id}",
                ResponseDecoder.json(new TypeReference<Map<String, Object>>() {
                }))
                .name("getThing")
                .pathParam("id", "t1")
                .resourceId("t1");
    }

    @Test
    void shouldDecodeSuccessfulJsonResponse() {
        httpEngine.enqueueJson(200, "{\"name\":\"thing\",\"extra\":1}");

        Map<String, Object> result = executor.execute(getThing().build());

        assertEquals("thing", result.get("name"));
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/instances/abc/v1/things/t1", request.target());
    }

    @Test
    void shouldSendBearerTokenAndAcceptHeader() {
        httpEngine.enqueueJson(200, "{}");

        executor.execute(getThing().build());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("Bearer " + TOKEN, request.headers().get("Authorization"));
        assertEquals("application/json", request.headers().get("Accept"));
    }

    @Test
    void shouldOmitAcceptHeaderWhenOperationClearsIt() {
        httpEngine.enqueueBytes(200, new byte[] { 1, 2, 3 }, "audio/ogg");

        byte[] audio = executor.execute(ApiOperation.builder(HttpMethod.GET, "v1/audio", ResponseDecoder.bytes())
                .accept(null)
                .build());

        assertArrayEquals(new byte[] { 1, 2, 3 }, audio);
        assertNull(httpEngine.takeRequest().headers().get("Accept"));
    }

    @Test
    void shouldEncodePathParameterAsSingleSegment() {
        httpEngine.enqueueJson(200, "{}");

        executor.execute(getThing().pathParam("id", "a/b c?").build());

        assertEquals("/instances/abc/v1/things/a%2Fb%20c%3F", httpEngine.takeRequest().target());
    }

    @ParameterizedTest
    @ValueSource(strings = { ".", "..", "%2e", "%2E%2e", ".%2E" })
    void shouldRejectDotSegmentPathParameterBeforeSending(String id) {
        ApiOperation<Map<String, Object>> operation = getThing().pathParam("id", id).build();

        assertThrows(IllegalArgumentException.class, () -> executor.execute(operation));
        assertEquals(0, httpEngine.getRequestCount());
    }

    @Test
    void shouldKeepDotsInsideLongerPathParameter() {
        httpEngine.enqueueJson(200, "{}");

        executor.execute(getThing().pathParam("id", "...").build());

        assertEquals("/instances/abc/v1/things/...", httpEngine.takeRequest().target());
    }

    @Test
    void shouldKeepQueryOrderAndSkipNullValues() {
        httpEngine.enqueueJson(200, "{}");

        executor.execute(getThing()
                .queryParam("text", "Hello world")
                .queryParam("voice", null)
                .queryParam("accept", "audio/l16;rate=16000")
                .build());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("text=Hello%20world&accept=audio%2Fl16%3Brate%3D16000", request.url().encodedQuery());
        assertEquals("audio/l16;rate=16000", request.url().queryParameter("accept"));
        assertNull(request.url().queryParameter("voice"));
    }

    @Test
    void shouldAppendToBaseUrlWithTrailingSlash() {
        WatsonHttpExecutor trailing = new WatsonHttpExecutor(new OkHttpClient.Builder()
                .addInterceptor(httpEngine).build(), new ObjectMapper(),
                ServiceEndpoint.of(BASE_URL + "/"), BearerTokenSource.of(TOKEN));
        httpEngine.enqueueJson(200, "{}");

        trailing.execute(getThing().build());

        assertEquals("/instances/abc/v1/things/t1", httpEngine.takeRequest().target());
    }

    @Test
    void shouldSendJsonPayload() {
        httpEngine.enqueueJson(201, "{}");

        executor.execute(ApiOperation.builder(HttpMethod.POST, "v1/things", ResponseDecoder.discarding())
                .payload(RequestPayload.json(Map.of("name", "n")))
                .successStatus(201)
                .build());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("{\"name\":\"n\"}", request.body());
        assertTrue(request.headers().get("Content-Type").startsWith("application/json"));
    }

    @ParameterizedTest
    @CsvSource({
            "304, NOT_MODIFIED",
            "400, BAD_REQUEST",
            "401, UNAUTHORIZED",
            "403, FORBIDDEN",
            "404, NOT_FOUND",
            "406, NOT_ACCEPTABLE",
            "415, UNSUPPORTED_MEDIA_TYPE",
            "500, INTERNAL_SERVER_ERROR",
            "503, SERVICE_UNAVAILABLE"
    })
    void shouldMapDocumentedStatuses(int status, WatsonErrorKind expected) {
        httpEngine.enqueueEmpty(status);
        ApiOperation<Map<String, Object>> operation = getThing()
                .errors(WatsonErrorKind.values())
                .build();

        WatsonApiException error = assertThrows(WatsonApiException.class, () -> executor.execute(operation));

        assertEquals(expected, error.getKind());
        assertEquals(status, error.getStatusCode());
        assertEquals("t1", error.getResourceId());
    }

    @Test
    void shouldReportUndocumentedStatusAsUnmapped() {
        httpEngine.enqueueEmpty(404);
        ApiOperation<Map<String, Object>> operation = getThing()
                .errors(WatsonErrorKind.BAD_REQUEST)
                .build();

        WatsonApiException error = assertThrows(WatsonApiException.class, () -> executor.execute(operation));

        assertEquals(WatsonErrorKind.UNMAPPED_RESPONSE, error.getKind());
        assertEquals(404, error.getStatusCode());
    }

    @Test
    void shouldReportTeapotAsUnmappedWithStatus() {
        httpEngine.enqueueText(418, "I'm a teapot", "text/plain");
        ApiOperation<Map<String, Object>> operation = getThing()
                .errors(WatsonErrorKind.values())
                .build();

        WatsonApiException error = assertThrows(WatsonApiException.class, () -> executor.execute(operation));

        assertEquals(WatsonErrorKind.UNMAPPED_RESPONSE, error.getKind());
        assertEquals(418, error.getStatusCode());
        assertEquals("I'm a teapot", error.getServiceMessage());
    }

    @Test
    void shouldExtractServiceMessageFromErrorBody() {
        httpEngine.enqueueJson(404,
                "{\"code\":404,\"error\":\"Model not found\",\"code_description\":\"Not Found\"}");
        ApiOperation<Map<String, Object>> operation = getThing()
                .errors(WatsonErrorKind.NOT_FOUND)
                .build();

        WatsonApiException error = assertThrows(WatsonApiException.class, () -> executor.execute(operation));

        assertEquals("Model not found", error.getServiceMessage());
        assertTrue(error.getMessage().contains("getThing"));
        assertTrue(error.getMessage().contains("Model not found"));
    }

    @Test
    void shouldWrapTransportFailure() {
        httpEngine.enqueueFailure(new ConnectException("Connection refused"));

        WatsonConnectionException error = assertThrows(WatsonConnectionException.class,
                () -> executor.execute(getThing().build()));

        assertEquals(WatsonErrorKind.CONNECTION_ERROR, error.getKind());
        assertTrue(error.getMessage().contains("Connection refused"));
        assertInstanceOf(ConnectException.class, error.getCause());
    }

    @Test
    void shouldReportUndecodableSuccessBodyAsInvalidResponse() {
        httpEngine.enqueueJson(200, "not json");

        WatsonApiException error = assertThrows(WatsonApiException.class,
                () -> executor.execute(getThing().build()));

        assertEquals(WatsonErrorKind.INVALID_RESPONSE, error.getKind());
        assertEquals(200, error.getStatusCode());
    }

    @Test
    void shouldReportMissingEnvelopeFieldAsInvalidResponse() {
        httpEngine.enqueueJson(200, "{\"other\":[]}");
        ApiOperation<List<String>> operation = ApiOperation
                .builder(HttpMethod.GET, "v1/things", ResponseDecoder.jsonField("things",
                        new TypeReference<List<String>>() {
                        }))
                .build();

        WatsonApiException error = assertThrows(WatsonApiException.class, () -> executor.execute(operation));

        assertEquals(WatsonErrorKind.INVALID_RESPONSE, error.getKind());
    }

    @Test
    void shouldRejectMissingPathParameterBeforeSending() {
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.DELETE, "v1/things/{id}", ResponseDecoder.discarding())
                .build();

        assertThrows(IllegalArgumentException.class, () -> executor.execute(operation));
        assertEquals(0, httpEngine.getRequestCount());
    }

    @Test
    void shouldRejectBodyOnGet() {
        ApiOperation.Builder<Void> builder = ApiOperation
                .builder(HttpMethod.GET, "v1/things", ResponseDecoder.discarding())
                .payload(RequestPayload.json(Map.of()));

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void shouldRejectCleartextEndpoint() {
        assertThrows(IllegalArgumentException.class, () -> ServiceEndpoint.of("http://example.com/api"));
        assertThrows(IllegalArgumentException.class, () -> ServiceEndpoint.of("not a url"));
        assertThrows(IllegalArgumentException.class, () -> ServiceEndpoint.of(" "));
    }

    @Test
    void shouldNotRetryFailedCall() {
        httpEngine.enqueueJson(503, "{}");
        ApiOperation<Map<String, Object>> operation = getThing()
                .errors(WatsonErrorKind.SERVICE_UNAVAILABLE)
                .build();

        WatsonApiException error = assertThrows(WatsonApiException.class, () -> executor.execute(operation));

        assertEquals(WatsonErrorKind.SERVICE_UNAVAILABLE, error.getKind());
        assertTrue(error.isRetryable());
        assertEquals(1, httpEngine.getRequestCount());
    }

    @Test
    void shouldApplyPerCallTimeout() {
        httpEngine.enqueueJson(200, "{\"name\":\"thing\"}");

        Map<String, Object> result = executor.execute(getThing().build(),
                RequestOptions.withTimeout(Duration.ofSeconds(2)));

        assertEquals("thing", result.get("name"));
        assertThrows(IllegalArgumentException.class, () -> RequestOptions.withTimeout(Duration.ZERO));
    }

    @Test
    void shouldCompleteAsyncCall() throws Exception {
        httpEngine.enqueueJson(200, "{\"name\":\"thing\"}");

        CompletableFuture<Map<String, Object>> future = executor.executeAsync(getThing().build());

        assertEquals("thing", future.get(5, TimeUnit.SECONDS).get("name"));
    }

    @Test
    void shouldFailAsyncCallWithTypedException() {
        httpEngine.enqueueFailure(new IOException("reset"));

        CompletableFuture<Map<String, Object>> future = executor.executeAsync(getThing().build());

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(WatsonConnectionException.class, error.getCause());
    }

    @Test
    void shouldCancelCallWhenFutureIsCancelled() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        httpEngine.enqueueHeld(200, "{}", entered, release);

        CompletableFuture<Map<String, Object>> future = executor.executeAsync(getThing().build());
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertTrue(future.cancel(true));
        try {
            assertTrue(httpEngine.getLastCall().isCanceled());
        } finally {
            release.countDown();
        }
    }

    @Test
    void shouldFailAsyncCallWhenDecoderThrows() {
        httpEngine.enqueueJson(200, "{}");
        ApiOperation<String> operation = ApiOperation
                .builder(HttpMethod.GET, "v1/things", (ResponseDecoder<String>) (body, mapper) -> {
                    throw new IllegalStateException("decoder failed");
                })
                .name("listThings")
                .build();

        CompletableFuture<String> future = executor.executeAsync(operation);

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("decoder failed", error.getCause().getMessage());
    }

    @Test
    void shouldReturnFailedFutureWhenRequestCannotBeBuilt() {
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.DELETE, "v1/things/{id}", ResponseDecoder.discarding())
                .build();

        CompletableFuture<Void> future = executor.executeAsync(operation);

        assertTrue(future.isCompletedExceptionally());
        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertEquals(0, httpEngine.getRequestCount());
    }
}
