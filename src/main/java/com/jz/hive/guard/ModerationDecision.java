package com.jz.hive.guard;


import lombok.*;

import java.time.LocalDateTime;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class ModerationDecision {
    public enum Action { ALLOWED, DENIED }

    private Action action;
    private DenialReason reason;        // 仅 DENIED
    private String policyMessage;       // 给用户看的提示
    private int warningCount;           // 判定后的警告次数
    private Long daysRemaining;         // 仅封禁
    private LocalDateTime suspensionEndsAt;

    public boolean isAllowed() {
        return action == Action.ALLOWED;
    }

    public static ModerationDecision allowed(int warningCount) {
        return ModerationDecision.builder().action(Action.ALLOWED).warningCount(warningCount).build();
    }
    public static ModerationDecision denied(DenialReason reason, String message, int warningCount) {
        return ModerationDecision.builder()
                .action(Action.DENIED).reason(reason).policyMessage(message).warningCount(warningCount)
                .build();
    }
    public static ModerationDecision suspended(String message, int warningCount,
                                               LocalDateTime endsAt, long daysRemaining) {
        return ModerationDecision.builder()
                .action(Action.DENIED).reason(DenialReason.SUSPENSION).policyMessage(message)
                .warningCount(warningCount).suspensionEndsAt(endsAt).daysRemaining(daysRemaining)
                .build();
    }
}
