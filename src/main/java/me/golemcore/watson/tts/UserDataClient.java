package me.golemcore.watson.tts;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.watson.http.ApiOperation;
import me.golemcore.watson.http.HttpMethod;
import me.golemcore.watson.http.RequestOptions;
import me.golemcore.watson.http.ResponseDecoder;
import me.golemcore.watson.http.WatsonHttpExecutor;

import static me.golemcore.watson.error.WatsonErrorKind.BAD_REQUEST;
import static me.golemcore.watson.error.WatsonErrorKind.INTERNAL_SERVER_ERROR;
import static me.golemcore.watson.error.WatsonErrorKind.SERVICE_UNAVAILABLE;

/**
 * Deletion of data labeled with a customer id.
 */
@Slf4j
@RequiredArgsConstructor
public class UserDataClient {

    private final WatsonHttpExecutor executor;

    /**
     * Deletes all data associated with the customer id, as labeled through
     * the {@code X-Watson-Metadata} header on earlier calls.
     */
    public void deleteUserData(String customerId) {
        deleteUserData(customerId, RequestOptions.defaults());
    }

    public void deleteUserData(String customerId, RequestOptions options) {
        Arguments.requireNonBlank(customerId, "customerId");
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.DELETE, "v1/user_data/{customer_id}", ResponseDecoder.discarding())
                .name("deleteUserData")
                .pathParam("customer_id", customerId)
                .successStatus(200, 204)
                .resourceId(customerId)
                .errors(BAD_REQUEST, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE)
                .build();
        executor.execute(operation, options);
        log.info("[TTS] User data deleted: customer={}", customerId);
    }
}
