package com.jz.hive.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallInfoDTO {
    private String callId;
    private String callType;
    private String status;
    private Long durationMs;
}
