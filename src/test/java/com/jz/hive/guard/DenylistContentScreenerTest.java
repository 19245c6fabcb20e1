package com.jz.hive.guard;

import com.jz.hive.config.ModerationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DenylistContentScreener")
class DenylistContentScreenerTest {

    private DenylistContentScreener screener;

    @BeforeEach
    void setUp() {
        ModerationProperties props = new ModerationProperties();
        props.setDenylist(List.of("spam", "Idiot", "  hate "));
        screener = new DenylistContentScreener(props);
    }

    @Test
    @DisplayName("matches case-insensitively inside longer words")
    void matchesSubstringIgnoringCase() {
        ScreenVerdict v = screener.screen("Stop being a SPAMMER");

        assertThat(v.isFlagged()).isTrue();
        assertThat(v.getMatchedTerm()).isEqualTo("spam");
    }

    @Test
    void normalizesConfiguredTerms() {
        assertThat(screener.screen("you IDIOT").isFlagged()).isTrue();
        assertThat(screener.screen("I hate mondays").getMatchedTerm()).isEqualTo("hate");
    }

    @Test
    void flagsBenignWordsContainingATerm() {
        // "whatever" contains "hate"
        assertThat(screener.screen("whatever works").isFlagged()).isTrue();
    }

    @Test
    void cleanMessagePasses() {
        assertThat(screener.screen("see you at lunch").isFlagged()).isFalse();
        assertThat(screener.screen("").isFlagged()).isFalse();
        assertThat(screener.screen(null).isFlagged()).isFalse();
    }
}
