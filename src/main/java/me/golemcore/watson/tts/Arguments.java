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

import me.golemcore.watson.error.WatsonFileReadException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class Arguments {

    private Arguments() {
    }

    static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    /**
     * Reads an upload payload before any request is built.
     */
    static byte[] readFile(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("Upload file is required");
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new WatsonFileReadException(file, e);
        }
    }
}
