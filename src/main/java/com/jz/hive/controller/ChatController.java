package com.jz.hive.controller;

import com.jz.hive.common.Result;
import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.SendMessageRequest;
import com.jz.hive.domain.dto.SendResult;
import com.jz.hive.domain.dto.SenderIdentity;
import com.jz.hive.service.ConversationService;
import com.jz.hive.service.MessageIngressService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("api/conversations/{conversationId}/messages")
@RequiredArgsConstructor
public class ChatController {

    private final MessageIngressService ingressService;
    private final ConversationService conversationService;

    /** 发送：审核拒绝返回 403 + 剩余警告信息，成功 201 */
    @PostMapping
    public ResponseEntity<Result<SendResult>> send(@PathVariable String conversationId,
                                                   @SessionAttribute("UID") String userId,
                                                   @SessionAttribute(value = "UNAME", required = false) String userName,
                                                   @RequestBody SendMessageRequest req) {
        SenderIdentity sender = SenderIdentity.of(userId, userName == null ? userId : userName);
        SendResult result = ingressService.sendMessage(conversationId, sender, req == null ? null : req.getContent());
        if (result.isAccepted()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(Result.created(result));
        }
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Result.rejected(result.getPolicyMessage(), result));
    }

    @GetMapping
    public Result<List<ChatMessageDTO>> history(@PathVariable String conversationId,
                                                @SessionAttribute("UID") String userId,
                                                @RequestParam(value = "afterSeq", defaultValue = "0") long afterSeq,
                                                @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return Result.success(conversationService.history(conversationId, userId, afterSeq, limit));
    }
}
