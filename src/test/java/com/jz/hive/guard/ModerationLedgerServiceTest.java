package com.jz.hive.guard;

import com.jz.hive.MutableClock;
import com.jz.hive.config.ModerationProperties;
import com.jz.hive.domain.entity.ModerationLog;
import com.jz.hive.domain.entity.UserModeration;
import com.jz.hive.mapper.ModerationLogMapper;
import com.jz.hive.mapper.UserModerationMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessException;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ModerationLedgerService")
class ModerationLedgerServiceTest {

    @Mock
    private UserModerationMapper ledgerMapper;

    @Mock
    private ModerationLogMapper logMapper;

    private final MutableClock clock = new MutableClock();
    private ModerationLedgerService ledger;

    @BeforeEach
    void setUp() {
        ledger = new ModerationLedgerService(ledgerMapper, logMapper, new ModerationProperties(), clock);
    }

    @Test
    @DisplayName("a suspension committed by a concurrent violation is seen through the locking read")
    void violationSeesConcurrentSuspension() {
        LocalDateTime now = LocalDateTime.now(clock);
        // 事务快照里还是 2 次警告、未封禁
        when(ledgerMapper.selectById("u1")).thenReturn(row(2, null));
        // 加锁当前读拿到并发事务刚提交的封禁
        when(ledgerMapper.selectForUpdate("u1")).thenReturn(row(3, now.plusDays(7)));

        ModerationDecision d = ledger.evaluate("u1", "spam", ScreenVerdict.flagged("spam"));

        assertThat(d.getReason()).isEqualTo(DenialReason.SUSPENSION);
        assertThat(d.getWarningCount()).isEqualTo(3);
        assertThat(d.getDaysRemaining()).isEqualTo(7);
        verify(ledgerMapper, never()).incrementWarning(anyString(), any());
        verify(logMapper, never()).insert(any(ModerationLog.class));
    }

    @Test
    void missingRowDuringIncrementIsAStoreFailure() {
        when(ledgerMapper.selectById("u2")).thenReturn(row(1, null));
        when(ledgerMapper.selectForUpdate("u2")).thenReturn(row(1, null));
        when(ledgerMapper.incrementWarning(anyString(), any())).thenReturn(0);

        assertThatThrownBy(() -> ledger.evaluate("u2", "spam", ScreenVerdict.flagged("spam")))
                .isInstanceOf(DataAccessException.class);
    }

    @Test
    void cleanMessageUsesPlainRead() {
        when(ledgerMapper.selectById("u3")).thenReturn(row(1, null));

        ModerationDecision d = ledger.evaluate("u3", "hello", ScreenVerdict.clean());

        assertThat(d.isAllowed()).isTrue();
        verify(ledgerMapper, never()).selectForUpdate(anyString());
    }

    private static UserModeration row(int count, LocalDateTime endsAt) {
        return UserModeration.builder().userId("u").warningCount(count).suspensionEndsAt(endsAt).build();
    }
}
