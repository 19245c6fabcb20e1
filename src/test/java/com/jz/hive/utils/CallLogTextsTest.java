package com.jz.hive.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class CallLogTextsTest {

    @ParameterizedTest
    @CsvSource({
            "video, 1000, Video call • 1s",
            "video, 45000, Video call • 45s",
            "audio, 59400, Audio call • 59s",
            "video, 59600, Video call • 1 min",
            "video, 61000, Video call • 2 min",
            "audio, 180000, Audio call • 3 min"
    })
    void formatsDuration(String type, long durationMs, String expected) {
        assertThat(CallLogTexts.ended(type, durationMs)).isEqualTo(expected);
    }

    @Test
    void missedCallText() {
        assertThat(CallLogTexts.missed("video")).isEqualTo("Missed video call");
        assertThat(CallLogTexts.missed("AUDIO")).isEqualTo("Missed audio call");
    }

    @Test
    void unknownTypeDefaultsToVideo() {
        assertThat(CallLogTexts.normalizeType(null)).isEqualTo("video");
        assertThat(CallLogTexts.calling("screen")).isEqualTo("Video call • Calling...");
    }
}
