package me.golemcore.watson.tts.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class AudioFormatTest {

    @ParameterizedTest
    @CsvSource({
            "FLAC, audio/flac;rate=22050",
            "OGG, audio/ogg;rate=22050",
            "OGG_OPUS, audio/ogg;codecs=opus;rate=48000",
            "OGG_VORBIS, audio/ogg;codecs=vorbis;rate=22050",
            "MP3, audio/mp3;rate=22050",
            "MPEG, audio/mpeg;rate=22050",
            "WAV, audio/wav;rate=22050",
            "WEBM_VORBIS, audio/webm;codecs=vorbis;rate=22050",
            "BASIC, audio/basic",
            "WEBM, audio/webm",
            "WEBM_OPUS, audio/webm;codecs=opus"
    })
    void shouldApplyDefaultRates(AudioEncoding encoding, String expected) {
        assertEquals(expected, AudioFormat.of(encoding).getMimeType());
    }

    @Test
    void shouldUseGivenRate() {
        assertEquals("audio/wav;rate=8000", AudioFormat.of(AudioEncoding.WAV, 8000).getMimeType());
        assertEquals("audio/alaw;rate=8000", AudioFormat.of(AudioEncoding.ALAW, 8000).getMimeType());
        assertEquals("audio/mulaw;rate=16000", AudioFormat.of(AudioEncoding.MULAW, 16000).getMimeType());
    }

    @Test
    void shouldRenderL16WithEndianness() {
        assertEquals("audio/l16;rate=16000;endianness=little-endian",
                AudioFormat.of(AudioEncoding.L16, 16000).getMimeType());
        assertEquals("audio/l16;rate=16000;endianness=big-endian",
                AudioFormat.l16(16000, AudioEndianness.BIG_ENDIAN).getMimeType());
    }

    @ParameterizedTest
    @EnumSource(value = AudioEncoding.class, names = { "ALAW", "MULAW", "L16" })
    void shouldRequireRate(AudioEncoding encoding) {
        assertThrows(IllegalArgumentException.class, () -> AudioFormat.of(encoding));
    }

    @ParameterizedTest
    @EnumSource(value = AudioEncoding.class, names = { "BASIC", "WEBM", "WEBM_OPUS" })
    void shouldRejectRateForFixedEncodings(AudioEncoding encoding) {
        assertThrows(IllegalArgumentException.class, () -> AudioFormat.of(encoding, 16000));
    }

    @Test
    void shouldRejectInvalidCombinations() {
        assertThrows(IllegalArgumentException.class,
                () -> new AudioFormat(AudioEncoding.WAV, 22050, AudioEndianness.BIG_ENDIAN));
        assertThrows(IllegalArgumentException.class, () -> AudioFormat.of(AudioEncoding.WAV, 0));
        assertThrows(IllegalArgumentException.class, () -> new AudioFormat(null, null, null));
    }

    @Test
    void defaultFormatShouldBeOggOpus() {
        AudioFormat format = AudioFormat.defaultFormat();

        assertEquals(AudioEncoding.OGG_OPUS, format.encoding());
        assertEquals(48000, format.getEffectiveRate());
    }
}
