package com.jz.hive.domain.dto;

import lombok.Data;

@Data
public class CreateGroupRequest {
    private String name;
    private String avatarRef;
}
