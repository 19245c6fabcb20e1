package com.jz.hive.guard;

import lombok.*;

import java.time.LocalDateTime;

/** 惰性解封之后的台账视图 */
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class ModerationStatus {
    private String userId;
    private int warningCount;
    private LocalDateTime suspensionEndsAt;
    private boolean suspended;
    private long daysRemaining;

    public static ModerationStatus clean(String userId) {
        return ModerationStatus.builder().userId(userId).warningCount(0).build();
    }
}
