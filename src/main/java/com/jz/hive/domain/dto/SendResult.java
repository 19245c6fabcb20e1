package com.jz.hive.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jz.hive.guard.DenialReason;
import com.jz.hive.guard.ModerationDecision;
import lombok.*;

/** SendMessage 的返回：Accepted(message) 或 Rejected(reason, policyMessage, warningCount) */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SendResult {
    public enum Status { ACCEPTED, REJECTED }

    private Status status;
    private ChatMessageDTO message;

    private DenialReason reason;
    private String policyMessage;
    private Integer warningCount;
    private Long daysRemaining;

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public static SendResult accepted(ChatMessageDTO message) {
        return SendResult.builder().status(Status.ACCEPTED).message(message).build();
    }

    public static SendResult rejected(ModerationDecision d) {
        return SendResult.builder()
                .status(Status.REJECTED)
                .reason(d.getReason())
                .policyMessage(d.getPolicyMessage())
                .warningCount(d.getWarningCount())
                .daysRemaining(d.getDaysRemaining())
                .build();
    }
}
