package com.jz.hive.utils;

import java.util.Objects;
import java.util.UUID;

public final class ConversationIds {
    private ConversationIds() {}

    public static final String GROUP_PREFIX = "g_";

    /** 单聊 id：两个 userId 排序后拼接，例如 u1001_u2002，谁先发起都一样 */
    public static String direct(String userA, String userB) {
        Objects.requireNonNull(userA, "userA");
        Objects.requireNonNull(userB, "userB");
        return userA.compareTo(userB) <= 0 ? userA + "_" + userB : userB + "_" + userA;
    }

    public static String group() {
        return GROUP_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }
}
