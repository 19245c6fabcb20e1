package com.jz.hive.domain.dto;

import lombok.Data;

@Data
public class OpenDirectRequest {
    private String peerId;
    private String peerDisplayName;
    private String peerAvatarRef;
}
