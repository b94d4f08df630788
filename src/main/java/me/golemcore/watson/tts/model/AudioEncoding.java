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
 * Audio encodings the synthesis endpoint can return, with their sampling
 * rate rules.
 */
public enum AudioEncoding {
    ALAW("audio/alaw", RateRule.REQUIRED, 0),
    BASIC("audio/basic", RateRule.FIXED, 8000),
    FLAC("audio/flac", RateRule.OPTIONAL, AudioEncoding.DEFAULT_RATE),
    L16("audio/l16", RateRule.REQUIRED, 0),
    OGG("audio/ogg", RateRule.OPTIONAL, AudioEncoding.DEFAULT_RATE),
    OGG_OPUS("audio/ogg;codecs=opus", RateRule.OPTIONAL, 48000),
    OGG_VORBIS("audio/ogg;codecs=vorbis", RateRule.OPTIONAL, AudioEncoding.DEFAULT_RATE),
    MP3("audio/mp3", RateRule.OPTIONAL, AudioEncoding.DEFAULT_RATE),
    MPEG("audio/mpeg", RateRule.OPTIONAL, AudioEncoding.DEFAULT_RATE),
    MULAW("audio/mulaw", RateRule.REQUIRED, 0),
    WAV("audio/wav", RateRule.OPTIONAL, AudioEncoding.DEFAULT_RATE),
    WEBM("audio/webm", RateRule.FIXED, 48000),
    WEBM_OPUS("audio/webm;codecs=opus", RateRule.FIXED, 48000),
    WEBM_VORBIS("audio/webm;codecs=vorbis", RateRule.OPTIONAL, AudioEncoding.DEFAULT_RATE);

    /**
     * Sampling rate the service uses when an optional rate is not given.
     */
    public static final int DEFAULT_RATE = 22050;

    enum RateRule {
        /** The caller must give a rate. */
        REQUIRED,
        /** A rate may be given; otherwise the encoding's default applies. */
        OPTIONAL,
        /** The service always uses the same rate; none is sent. */
        FIXED
    }

    private final String baseMimeType;
    private final RateRule rateRule;
    private final int defaultRate;

    AudioEncoding(String baseMimeType, RateRule rateRule, int defaultRate) {
        this.baseMimeType = baseMimeType;
        this.rateRule = rateRule;
        this.defaultRate = defaultRate;
    }

    public String getBaseMimeType() {
        return baseMimeType;
    }

    /**
     * @return the rate used when none is given, or {@code 0} when a rate is
     *         required
     */
    public int getDefaultRate() {
        return defaultRate;
    }

    public boolean isRateRequired() {
        return rateRule == RateRule.REQUIRED;
    }

    public boolean isRateFixed() {
        return rateRule == RateRule.FIXED;
    }
}
