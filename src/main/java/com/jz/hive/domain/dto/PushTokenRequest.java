package com.jz.hive.domain.dto;

import lombok.Data;

@Data
public class PushTokenRequest {
    private String token;
}
