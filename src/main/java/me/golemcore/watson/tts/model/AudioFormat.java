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
 * Requested synthesis output, rendered as the MIME type passed in the
 * {@code accept} query parameter, e.g. {@code audio/ogg;codecs=opus;rate=48000}
 * or {@code audio/l16;rate=16000;endianness=little-endian}.
 *
 * @param encoding
 *            audio encoding
 * @param sampleRate
 *            sampling rate in Hz; {@code null} for the encoding's default.
 *            Required for alaw, l16 and mulaw, not accepted for basic, webm
 *            and webm/opus
 * @param endianness
 *            byte order, l16 only; {@code null} means little-endian
 */
public record AudioFormat(AudioEncoding encoding, Integer sampleRate, AudioEndianness endianness) {

    public AudioFormat {
        if (encoding == null) {
            throw new IllegalArgumentException("Audio encoding is required");
        }
        if (sampleRate != null && sampleRate <= 0) {
            throw new IllegalArgumentException("Sampling rate must be positive: " + sampleRate);
        }
        if (encoding.isRateRequired() && sampleRate == null) {
            throw new IllegalArgumentException(encoding.getBaseMimeType() + " requires a sampling rate");
        }
        if (encoding.isRateFixed() && sampleRate != null) {
            throw new IllegalArgumentException(encoding.getBaseMimeType() + " has a fixed sampling rate");
        }
        if (endianness != null && encoding != AudioEncoding.L16) {
            throw new IllegalArgumentException("Endianness applies to audio/l16 only");
        }
    }

    /**
     * Ogg/Opus at 48000 Hz, the service's default output.
     */
    public static AudioFormat defaultFormat() {
        return of(AudioEncoding.OGG_OPUS);
    }

    public static AudioFormat of(AudioEncoding encoding) {
        return new AudioFormat(encoding, null, null);
    }

    public static AudioFormat of(AudioEncoding encoding, int sampleRate) {
        return new AudioFormat(encoding, sampleRate, null);
    }

    public static AudioFormat l16(int sampleRate, AudioEndianness endianness) {
        return new AudioFormat(AudioEncoding.L16, sampleRate, endianness);
    }

    public int getEffectiveRate() {
        return sampleRate != null ? sampleRate : encoding.getDefaultRate();
    }

    public String getMimeType() {
        StringBuilder sb = new StringBuilder(encoding.getBaseMimeType());
        if (!encoding.isRateFixed()) {
            sb.append(";rate=").append(getEffectiveRate());
        }
        if (encoding == AudioEncoding.L16) {
            AudioEndianness order = endianness != null ? endianness : AudioEndianness.LITTLE_ENDIAN;
            sb.append(";endianness=").append(order.getId());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getMimeType();
    }
}
