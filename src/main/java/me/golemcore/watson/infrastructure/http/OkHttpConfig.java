package me.golemcore.watson.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.watson.infrastructure.config.WatsonProperties;
import okhttp3.ConnectionPool;
import okhttp3.ConnectionSpec;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for all Watson clients.
 *
 * <p>
 * Configured from {@link WatsonProperties.HttpProperties}:
 * <ul>
 * <li>Connect, read and write timeouts</li>
 * <li>Connection pool - one pool for IAM and every service instance</li>
 * <li>TLS only - no cleartext connection spec</li>
 * <li>No transparent retry on connection failure</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class OkHttpConfig {

    private final WatsonProperties properties;

    @Bean
    @ConditionalOnMissingBean
    public OkHttpClient okHttpClient() {
        return createClient(properties.getHttp());
    }

    public static OkHttpClient createClient(WatsonProperties.HttpProperties http) {
        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .connectionSpecs(List.of(ConnectionSpec.MODERN_TLS))
                .retryOnConnectionFailure(false)
                .build();
    }
}
