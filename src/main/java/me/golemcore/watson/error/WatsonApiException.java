package me.golemcore.watson.error;

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

/**
 * The service answered, and the answer was not a success for the operation.
 *
 * <p>
 * Carries the raw status code (always set, also for
 * {@link WatsonErrorKind#UNMAPPED_RESPONSE}), the identifier the operation
 * was addressed to when there is one, and the message from the service's
 * error body when it could be read.
 */
public class WatsonApiException extends WatsonException {

    private final int statusCode;
    private final String resourceId;
    private final String serviceMessage;

    public WatsonApiException(WatsonErrorKind kind, String operation, int statusCode, String resourceId,
            String serviceMessage) {
        super(kind, buildMessage(kind, operation, statusCode, resourceId, serviceMessage));
        this.statusCode = statusCode;
        this.resourceId = resourceId;
        this.serviceMessage = serviceMessage;
    }

    public WatsonApiException(String operation, int statusCode, Throwable decodeFailure) {
        super(WatsonErrorKind.INVALID_RESPONSE,
                buildMessage(WatsonErrorKind.INVALID_RESPONSE, operation, statusCode, null,
                        decodeFailure.getMessage()),
                decodeFailure);
        this.statusCode = statusCode;
        this.resourceId = null;
        this.serviceMessage = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the identifier (customization, speaker, word...) the failed call
     *         addressed, or {@code null}
     */
    public String getResourceId() {
        return resourceId;
    }

    public String getServiceMessage() {
        return serviceMessage;
    }

    private static String buildMessage(WatsonErrorKind kind, String operation, int statusCode, String resourceId,
            String serviceMessage) {
        StringBuilder sb = new StringBuilder()
                .append(operation)
                .append(" failed (HTTP ")
                .append(statusCode)
                .append("): ")
                .append(kind.getDescription());
        if (resourceId != null) {
            sb.append(" [").append(resourceId).append(']');
        }
        if (serviceMessage != null && !serviceMessage.isBlank()) {
            sb.append(". ").append(serviceMessage);
        }
        return sb.toString();
    }
}
