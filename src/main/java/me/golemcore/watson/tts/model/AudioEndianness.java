package me.golemcore.watson.tts.model;

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
 * Byte order of {@code audio/l16} output.
 */
public enum AudioEndianness {
    BIG_ENDIAN("big-endian"),
    LITTLE_ENDIAN("little-endian");

    private final String id;

    AudioEndianness(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
