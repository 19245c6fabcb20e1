package com.jz.hive.guard;

import com.jz.hive.config.ModerationProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConversationModerationService")
class ConversationModerationServiceTest {

    @Mock
    private ContentScreener screener;

    @Mock
    private ModerationLedgerService ledger;

    private ModerationProperties props;
    private SimpleMeterRegistry registry;
    private ConversationModerationService service;

    @BeforeEach
    void setUp() {
        props = new ModerationProperties();
        registry = new SimpleMeterRegistry();
        service = new ConversationModerationService(screener, ledger, props, registry);
    }

    @Test
    void passesScreenVerdictToLedger() {
        ScreenVerdict verdict = ScreenVerdict.flagged("spam");
        ModerationDecision denied = ModerationDecision.denied(DenialReason.WARNING, "w", 1);
        when(screener.screen("spam!")).thenReturn(verdict);
        when(ledger.evaluate("u1", "spam!", verdict)).thenReturn(denied);

        assertThat(service.preModerate("u1", "spam!")).isSameAs(denied);
        verify(ledger).evaluate(eq("u1"), eq("spam!"), eq(verdict));
    }

    @Test
    @DisplayName("store timeout fails open by default and is counted")
    void failsOpenWhenStoreUnavailable() {
        when(screener.screen(anyString())).thenReturn(ScreenVerdict.flagged("spam"));
        when(ledger.evaluate(anyString(), anyString(), any())).thenThrow(new QueryTimeoutException("timeout"));

        ModerationDecision d = service.preModerate("u1", "spam");

        assertThat(d.isAllowed()).isTrue();
        assertThat(registry.counter("moderation.fail_open.count").count()).isEqualTo(1.0);
    }

    @Test
    void failsClosedWhenConfigured() {
        props.setFailurePolicy(FailurePolicy.FAIL_CLOSED);
        when(screener.screen(anyString())).thenReturn(ScreenVerdict.clean());
        when(ledger.evaluate(anyString(), anyString(), any()))
                .thenThrow(new CannotCreateTransactionException("no connection"));

        ModerationDecision d = service.preModerate("u1", "hello");

        assertThat(d.isAllowed()).isFalse();
        assertThat(d.getReason()).isEqualTo(DenialReason.UNAVAILABLE);
        assertThat(d.getPolicyMessage()).isEqualTo(props.getUnavailableMessage());
        assertThat(registry.counter("moderation.fail_closed.count").count()).isEqualTo(1.0);
    }
}
