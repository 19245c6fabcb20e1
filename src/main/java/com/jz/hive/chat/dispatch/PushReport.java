package com.jz.hive.chat.dispatch;

import java.util.List;
import java.util.Set;

/** 一次多端推送的结果；只有 token 层面的失败会出现在 failures 里 */
public record PushReport(int successCount, List<TokenFailure> failures) {

    /** 推送方返回这两个错误码时 token 已确定失效，需要从注册集合里删掉 */
    public static final Set<String> INVALID_TOKEN_CODES =
            Set.of("invalid-registration-token", "registration-token-not-registered");

    public record TokenFailure(String token, String errorCode) {
        public boolean isTokenInvalid() {
            return errorCode != null && INVALID_TOKEN_CODES.contains(errorCode);
        }
    }

    public static PushReport allDelivered(int n) {
        return new PushReport(n, List.of());
    }

    public List<String> invalidTokens() {
        return failures.stream().filter(TokenFailure::isTokenInvalid).map(TokenFailure::token).toList();
    }
}
