package com.jz.hive.controller;

import com.jz.hive.common.Result;
import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.ResolveCallRequest;
import com.jz.hive.domain.dto.SenderIdentity;
import com.jz.hive.domain.dto.StartCallRequest;
import com.jz.hive.service.CallLogService;
import com.jz.hive.service.ConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("api/conversations/{conversationId}/calls")
@RequiredArgsConstructor
public class CallLogController {

    private final CallLogService callLogService;
    private final ConversationService conversationService;

    @PostMapping
    public Result<ChatMessageDTO> start(@PathVariable String conversationId,
                                        @SessionAttribute("UID") String userId,
                                        @SessionAttribute(value = "UNAME", required = false) String userName,
                                        @RequestBody(required = false) StartCallRequest req) {
        StartCallRequest r = req == null ? new StartCallRequest() : req;
        SenderIdentity caller = SenderIdentity.of(userId, userName == null ? userId : userName);
        return Result.created(callLogService.startCall(conversationId, caller, r.getCallType(), r.getCorrelationId()));
    }

    /** 未知的 correlationId 也返回 200：已经被清理过了 */
    @PostMapping("{correlationId}/resolve")
    public Result<Void> resolve(@PathVariable String conversationId,
                                @PathVariable String correlationId,
                                @SessionAttribute("UID") String userId,
                                @RequestBody ResolveCallRequest req) {
        conversationService.requireMember(conversationId, userId);
        callLogService.resolveCall(conversationId, correlationId, req.getOutcome(), req.getDurationMs());
        return Result.success(null);
    }
}
