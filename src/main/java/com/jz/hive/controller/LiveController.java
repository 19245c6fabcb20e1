package com.jz.hive.controller;

import com.jz.hive.chat.dispatch.LiveEventBus;
import com.jz.hive.service.ConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("api/conversations/{conversationId}/live")
@RequiredArgsConstructor
public class LiveController {

    private final LiveEventBus liveBus;
    private final ConversationService conversationService;

    /** SSE：newMessage / callLogUpdated / callLogDeleted */
    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String conversationId, @SessionAttribute("UID") String userId) {
        conversationService.requireMember(conversationId, userId);
        return liveBus.openStream(conversationId);
    }
}
