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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.watson.auth.IamAuthenticator;
import me.golemcore.watson.http.ServiceEndpoint;
import me.golemcore.watson.http.WatsonHttpExecutor;
import me.golemcore.watson.infrastructure.http.OkHttpConfig;
import me.golemcore.watson.stt.SpeechToText;
import me.golemcore.watson.tts.TextToSpeech;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;

/**
 * Spring Boot auto-configuration of the Watson clients.
 *
 * <p>
 * {@link IamAuthenticator} is created when {@code watson.iam.api-key} is set;
 * {@link TextToSpeech} and {@link SpeechToText} when their instance URLs are
 * set as well.
 */
@Slf4j
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(WatsonProperties.class)
@Import(OkHttpConfig.class)
public class WatsonAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper watsonObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "watson.iam", name = "api-key")
    public IamAuthenticator iamAuthenticator(OkHttpClient okHttpClient, ObjectMapper objectMapper,
            WatsonProperties properties) {
        WatsonProperties.IamProperties iam = properties.getIam();
        log.info("[IAM] Authenticator configured: url={}, autoRefresh={}, refreshSkew={}",
                iam.getUrl(), iam.isAutoRefresh(), iam.getRefreshSkew());
        return new IamAuthenticator(okHttpClient, objectMapper, iam.getApiKey(), iam.getUrl(),
                iam.isAutoRefresh(), iam.getRefreshSkew(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "watson", name = { "iam.api-key", "tts.url" })
    public TextToSpeech textToSpeech(OkHttpClient okHttpClient, ObjectMapper objectMapper,
            IamAuthenticator authenticator, WatsonProperties properties) {
        WatsonProperties.TtsProperties tts = properties.getTts();
        WatsonHttpExecutor executor = new WatsonHttpExecutor(okHttpClient, objectMapper,
                ServiceEndpoint.of(tts.getUrl()), authenticator);
        log.info("[TTS] Client configured: defaultVoice={}", tts.getDefaultVoice().getId());
        return new TextToSpeech(executor, tts.getDefaultVoice());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "watson", name = { "iam.api-key", "stt.url" })
    public SpeechToText speechToText(OkHttpClient okHttpClient, ObjectMapper objectMapper,
            IamAuthenticator authenticator, WatsonProperties properties) {
        log.info("[STT] Client configured");
        return new SpeechToText(okHttpClient, objectMapper, ServiceEndpoint.of(properties.getStt().getUrl()),
                authenticator);
    }
}
