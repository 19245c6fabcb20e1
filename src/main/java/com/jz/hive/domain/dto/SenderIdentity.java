package com.jz.hive.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 鉴权方给的身份，进入发送链路之前已经校验过 */
@Data
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
public class SenderIdentity {
    private String userId;
    private String displayName;
}
