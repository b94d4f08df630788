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

import java.io.IOException;
import java.nio.file.Path;

/**
 * A local upload payload (speaker enrollment or prompt audio) could not be
 * read. Raised before any request is sent.
 */
public class WatsonFileReadException extends WatsonException {

    private final transient Path file;

    public WatsonFileReadException(Path file, IOException cause) {
        super(WatsonErrorKind.FILE_READ_ERROR, "There was an error reading the file " + file + ": "
                + cause.getMessage(), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
