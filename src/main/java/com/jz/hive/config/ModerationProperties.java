package com.jz.hive.config;


import com.jz.hive.guard.FailurePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "chat.moderation")
public class ModerationProperties {

    /** 敏感词表（小写，子串匹配，"spam" 会命中 "spammer"） */
    private List<String> denylist = new ArrayList<>(List.of(
            // profanity
            "damn", "hell", "crap", "stupid", "idiot", "moron", "fool", "loser",
            // harassment
            "abusive", "harassment", "bully", "bullying", "threat", "threatening", "intimidate", "intimidation",
            // hate
            "hate", "racist", "racism", "sexist", "sexism", "discriminate", "discrimination", "prejudice",
            // spam
            "spam", "scam", "fraud", "phishing", "clickbait",
            // inappropriate
            "inappropriate", "offensive", "vulgar", "obscene", "explicit",
            // violence
            "violence", "violent", "attack", "assault", "harm", "hurt", "kill", "murder"
    ));

    /** 第几次违规触发封禁 */
    private int suspensionThreshold = 3;

    /** 封禁天数 */
    private int suspensionDays = 7;

    /** 存储不可用时的策略，默认放行 */
    private FailurePolicy failurePolicy = FailurePolicy.FAIL_OPEN;

    /** 审计日志里保存的消息摘录长度 */
    private int excerptLength = 100;

    private String warningMessage =
            "Warning: Your message contains inappropriate content. Please be respectful.";

    /** %d = 封禁天数 */
    private String finalWarningMessage =
            "Final Warning: Your message contains inappropriate content. One more violation will result in a %d-day suspension.";

    /** %d = 封禁天数 */
    private String suspensionMessage =
            "You have been suspended from sending messages for %d days due to repeated violations.";

    /** %d = 剩余天数 */
    private String suspendedGateMessage =
            "You are suspended from sending messages. Your suspension will end in %d day(s).";

    private String unavailableMessage =
            "Messaging is temporarily unavailable. Please try again shortly.";
}
