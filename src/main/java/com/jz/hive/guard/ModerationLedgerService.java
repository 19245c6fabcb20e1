package com.jz.hive.guard;

import com.jz.hive.config.ModerationProperties;
import com.jz.hive.domain.entity.ModerationLog;
import com.jz.hive.domain.entity.UserModeration;
import com.jz.hive.mapper.ModerationLogMapper;
import com.jz.hive.mapper.UserModerationMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 审核状态机：Clean(0) → Warned(1) → FinalWarned(2) → Suspended(3, endsAt)。
 * 只有违规消息会推动状态；计数只能在封禁到期时归零。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationLedgerService {

    private static final long DAY_MS = Duration.ofDays(1).toMillis();

    static final String REASON_VIOLATION = "Negative word detected in message";
    static final String REASON_EXPIRED = "Suspension period expired";

    private final UserModerationMapper ledgerMapper;
    private final ModerationLogMapper logMapper;
    private final ModerationProperties props;
    private final Clock clock;

    /**
     * 台账 + 惰性解封 + 判定，整个在一个事务里：要么台账变更和审计日志一起落库，要么都不落。
     */
    @Transactional(rollbackFor = Exception.class)
    public ModerationDecision evaluate(String userId, String content, ScreenVerdict verdict) {
        LocalDateTime now = LocalDateTime.now(clock);

        // 干净消息：快照读即可，过期封禁顺手解掉；封禁中照样拒绝
        if (verdict == null || !verdict.isFlagged()) {
            ModerationStatus status = loadWithLazyExpiry(userId, now, false);
            return status.isSuspended() ? suspendedGate(status) : ModerationDecision.allowed(status.getWarningCount());
        }

        // 违规：先保证有行，再加锁读最新值，同一用户的并发违规从这里开始串行
        ensureLedgerRow(userId);
        ModerationStatus status = loadWithLazyExpiry(userId, now, true);
        if (status.isSuspended()) {
            // 封禁中不再累计警告
            return suspendedGate(status);
        }

        // 升级：原子 +1
        if (ledgerMapper.incrementWarning(userId, now) == 0) {
            // 持锁且未封禁仍没更新到，只可能是行被删了，按存储故障交给失败策略
            throw new EmptyResultDataAccessException("moderation ledger row missing, userId=" + userId, 1);
        }
        int count = ledgerMapper.selectForUpdate(userId).getWarningCount();

        ModerationAction action;
        String message;
        LocalDateTime endsAt = null;
        if (count >= props.getSuspensionThreshold()) {
            action = ModerationAction.SUSPENSION;
            message = String.format(props.getSuspensionMessage(), props.getSuspensionDays());
            endsAt = now.plusDays(props.getSuspensionDays());
            ledgerMapper.suspend(userId, endsAt, now);
        } else if (count == props.getSuspensionThreshold() - 1) {
            action = ModerationAction.FINAL_WARNING;
            message = String.format(props.getFinalWarningMessage(), props.getSuspensionDays());
        } else {
            action = ModerationAction.WARNING;
            message = props.getWarningMessage();
        }

        appendLog(userId, action, REASON_VIOLATION, excerpt(content), count);
        log.info("[Moderation] {} for user {} (count={}, term={})", action.wire(), userId, count, verdict.getMatchedTerm());

        if (endsAt != null) {
            return ModerationDecision.suspended(message, count, endsAt, props.getSuspensionDays());
        }
        return ModerationDecision.denied(DenialReason.of(action), message, count);
    }

    /** 状态查询也走惰性解封：过期之后第一次读就归零 */
    @Transactional(rollbackFor = Exception.class)
    public ModerationStatus status(String userId) {
        return loadWithLazyExpiry(userId, LocalDateTime.now(clock), false);
    }

    public List<ModerationLog> recentLogs(String userId, int limit) {
        int n = Math.max(1, Math.min(limit, 500));
        return (userId == null || userId.isBlank())
                ? logMapper.selectRecent(n)
                : logMapper.selectRecentByUser(userId, n);
    }

    private ModerationStatus loadWithLazyExpiry(String userId, LocalDateTime now, boolean lock) {
        UserModeration row = read(userId, lock);
        if (row == null) {
            return ModerationStatus.clean(userId);
        }
        LocalDateTime endsAt = row.getSuspensionEndsAt();
        if (endsAt != null && !endsAt.isAfter(now)) {
            if (ledgerMapper.clearExpiredSuspension(userId, now) == 1) {
                appendLog(userId, ModerationAction.SUSPENSION_REMOVED, REASON_EXPIRED, null, 0);
                log.info("[Moderation] suspension_removed for user {}: {}", userId, REASON_EXPIRED);
            }
            row = read(userId, lock);
            endsAt = row.getSuspensionEndsAt();
        }
        int count = row.getWarningCount() == null ? 0 : row.getWarningCount();
        boolean suspended = endsAt != null && endsAt.isAfter(now);
        return ModerationStatus.builder()
                .userId(userId)
                .warningCount(count)
                .suspensionEndsAt(suspended ? endsAt : null)
                .suspended(suspended)
                .daysRemaining(suspended ? ceilDays(now, endsAt) : 0)
                .build();
    }

    private UserModeration read(String userId, boolean lock) {
        return lock ? ledgerMapper.selectForUpdate(userId) : ledgerMapper.selectById(userId);
    }

    private ModerationDecision suspendedGate(ModerationStatus status) {
        String msg = String.format(props.getSuspendedGateMessage(), status.getDaysRemaining());
        return ModerationDecision.suspended(msg, status.getWarningCount(),
                status.getSuspensionEndsAt(), status.getDaysRemaining());
    }

    /** 第一次违规时建行；并发建行撞唯一键说明别人已经建好了 */
    private void ensureLedgerRow(String userId) {
        if (ledgerMapper.selectById(userId) != null) return;
        try {
            ledgerMapper.insert(UserModeration.builder().userId(userId).warningCount(0).build());
        } catch (DuplicateKeyException dup) {
            log.debug("ledger row created concurrently, userId={}", userId);
        }
    }

    private void appendLog(String userId, ModerationAction action, String reason, String excerpt, int countAfter) {
        logMapper.insert(ModerationLog.builder()
                .userId(userId)
                .action(action.wire())
                .reason(reason)
                .messageExcerpt(excerpt)
                .warningCountAfter(countAfter)
                .build());
    }

    private String excerpt(String content) {
        if (content == null) return null;
        int max = props.getExcerptLength();
        return content.length() > max ? content.substring(0, max) : content;
    }

    static long ceilDays(LocalDateTime now, LocalDateTime endsAt) {
        long ms = Duration.between(now, endsAt).toMillis();
        return ms <= 0 ? 0 : (ms + DAY_MS - 1) / DAY_MS;
    }
}
