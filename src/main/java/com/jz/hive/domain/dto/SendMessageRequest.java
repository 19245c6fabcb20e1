package com.jz.hive.domain.dto;

import lombok.Data;

@Data
public class SendMessageRequest {
    private String content;
}
