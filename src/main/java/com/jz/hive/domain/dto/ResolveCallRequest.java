package com.jz.hive.domain.dto;

import com.jz.hive.chat.dispatch.CallOutcome;
import lombok.Data;

@Data
public class ResolveCallRequest {
    private CallOutcome outcome;
    private long durationMs;
}
