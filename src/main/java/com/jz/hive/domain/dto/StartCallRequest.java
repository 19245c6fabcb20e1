package com.jz.hive.domain.dto;

import lombok.Data;

@Data
public class StartCallRequest {
    /** audio / video，缺省 video */
    private String callType;
    /** 客户端生成的关联 id，结算时用它找占位消息；不传则服务端生成 */
    private String correlationId;
}
