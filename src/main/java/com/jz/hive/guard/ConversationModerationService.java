package com.jz.hive.guard;

import com.jz.hive.config.ModerationProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * 发送前的审核闸门：先筛内容，再查/改台账。
 * 台账存储不可用时按 {@link FailurePolicy} 处理，默认放行，错误只进日志和指标。
 */
@Slf4j
@Service
public class ConversationModerationService {

    private final ContentScreener screener;
    private final ModerationLedgerService ledger;
    private final ModerationProperties props;
    private final Counter failOpenCounter;
    private final Counter failClosedCounter;

    public ConversationModerationService(ContentScreener screener,
                                         ModerationLedgerService ledger,
                                         ModerationProperties props,
                                         MeterRegistry registry) {
        this.screener = screener;
        this.ledger = ledger;
        this.props = props;
        this.failOpenCounter = Counter.builder("moderation.fail_open.count")
                .description("Messages let through because the moderation store was unavailable")
                .register(registry);
        this.failClosedCounter = Counter.builder("moderation.fail_closed.count")
                .description("Messages refused because the moderation store was unavailable")
                .register(registry);
    }

    public ModerationDecision preModerate(String userId, String content) {
        ScreenVerdict verdict = screener.screen(content);
        try {
            return ledger.evaluate(userId, content, verdict);
        } catch (DataAccessException | TransactionException e) {
            return onStoreFailure(userId, verdict, e);
        }
    }

    private ModerationDecision onStoreFailure(String userId, ScreenVerdict verdict, RuntimeException e) {
        if (props.getFailurePolicy() == FailurePolicy.FAIL_CLOSED) {
            failClosedCounter.increment();
            log.error("moderation store unavailable, failing closed, userId={}, flagged={}, err={}",
                    userId, verdict.isFlagged(), e.getMessage(), e);
            return ModerationDecision.denied(DenialReason.UNAVAILABLE, props.getUnavailableMessage(), 0);
        }
        failOpenCounter.increment();
        log.error("moderation store unavailable, failing open, userId={}, flagged={}, err={}",
                userId, verdict.isFlagged(), e.getMessage(), e);
        return ModerationDecision.allowed(0);
    }
}
