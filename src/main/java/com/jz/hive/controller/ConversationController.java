package com.jz.hive.controller;

import com.jz.hive.common.Result;
import com.jz.hive.domain.dto.CreateGroupRequest;
import com.jz.hive.domain.dto.OpenDirectRequest;
import com.jz.hive.domain.dto.SenderIdentity;
import com.jz.hive.domain.entity.Conversation;
import com.jz.hive.domain.entity.ConversationSummary;
import com.jz.hive.service.ConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    /** 收件箱：最新的在前 */
    @GetMapping
    public Result<List<ConversationSummary>> inbox(@SessionAttribute("UID") String userId) {
        return Result.success(conversationService.inbox(userId));
    }

    @PostMapping("{peerId}/read")
    public Result<Boolean> markRead(@PathVariable String peerId, @SessionAttribute("UID") String userId) {
        return Result.success(conversationService.markRead(userId, peerId));
    }

    @PostMapping("direct")
    public Result<Conversation> openDirect(@SessionAttribute("UID") String userId,
                                           @SessionAttribute(value = "UNAME", required = false) String userName,
                                           @RequestBody OpenDirectRequest req) {
        return Result.success(conversationService.openDirect(identity(userId, userName), req));
    }

    @PostMapping("groups")
    public Result<Conversation> createGroup(@SessionAttribute("UID") String userId,
                                            @SessionAttribute(value = "UNAME", required = false) String userName,
                                            @RequestBody CreateGroupRequest req) {
        return Result.created(conversationService.createGroup(identity(userId, userName), req));
    }

    @PostMapping("{conversationId}/members")
    public Result<Void> join(@PathVariable String conversationId,
                             @SessionAttribute("UID") String userId,
                             @SessionAttribute(value = "UNAME", required = false) String userName) {
        conversationService.join(conversationId, identity(userId, userName));
        return Result.success(null);
    }

    @DeleteMapping("{conversationId}/members/{memberId}")
    public Result<Void> remove(@PathVariable String conversationId,
                               @PathVariable String memberId,
                               @SessionAttribute("UID") String userId) {
        conversationService.removeMember(conversationId, userId, memberId);
        return Result.success(null);
    }

    private static SenderIdentity identity(String userId, String userName) {
        return SenderIdentity.of(userId, userName == null ? userId : userName);
    }
}
