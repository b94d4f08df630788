package me.golemcore.watson.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import me.golemcore.watson.auth.IamAuthenticator;
import me.golemcore.watson.tts.model.WatsonVoice;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration of the Watson clients, bound from the {@code watson.*}
 * prefix.
 *
 * <p>
 * Nested groups:
 * <ul>
 * <li>{@link IamProperties} - API key and token exchange</li>
 * <li>{@link TtsProperties} - Text to Speech instance</li>
 * <li>{@link SttProperties} - Speech to Text instance</li>
 * <li>{@link HttpProperties} - shared transport timeouts and pool</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "watson")
@Data
public class WatsonProperties {

    private IamProperties iam = new IamProperties();
    private TtsProperties tts = new TtsProperties();
    private SttProperties stt = new SttProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class IamProperties {
        private String apiKey;
        private String url = IamAuthenticator.DEFAULT_URL;
        private boolean autoRefresh = true;
        private Duration refreshSkew = IamAuthenticator.DEFAULT_REFRESH_SKEW;
    }

    @Data
    public static class TtsProperties {
        /**
         * Instance URL, e.g.
         * {@code https://api.eu-de.text-to-speech.watson.cloud.ibm.com/instances/<guid>}.
         */
        private String url;
        private WatsonVoice defaultVoice = WatsonVoice.DEFAULT;
    }

    @Data
    public static class SttProperties {
        private String url;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
