package me.golemcore.watson.testsupport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.watson.auth.BearerTokenSource;
import me.golemcore.watson.http.ServiceEndpoint;
import me.golemcore.watson.http.WatsonHttpExecutor;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Executors wired to an {@link OkHttpMockEngine}.
 */
public final class WatsonTestClients {

    public static final String BASE_URL = "https://api.test.watson.cloud.ibm.com/instances/guid";
    public static final String BASE_PATH = "/instances/guid";
    public static final String TOKEN = "test-token";

    private WatsonTestClients() {
    }

    public static WatsonHttpExecutor executor(OkHttpMockEngine httpEngine) {
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(1, TimeUnit.SECONDS)
                .readTimeout(1, TimeUnit.SECONDS)
                .addInterceptor(httpEngine)
                .build();
        return new WatsonHttpExecutor(client, new ObjectMapper(), ServiceEndpoint.of(BASE_URL),
                BearerTokenSource.of(TOKEN));
    }
}
