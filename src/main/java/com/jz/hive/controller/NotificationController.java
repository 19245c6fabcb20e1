package com.jz.hive.controller;

import com.jz.hive.common.Result;
import com.jz.hive.domain.dto.PushTokenRequest;
import com.jz.hive.domain.entity.Notification;
import com.jz.hive.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public Result<List<Notification>> recent(@SessionAttribute("UID") String userId,
                                             @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return Result.success(notificationService.recent(userId, limit));
    }

    @PostMapping("{id}/read")
    public Result<Boolean> markRead(@PathVariable Long id, @SessionAttribute("UID") String userId) {
        return Result.success(notificationService.markRead(userId, id));
    }

    @PostMapping("tokens")
    public Result<Void> register(@SessionAttribute("UID") String userId, @RequestBody PushTokenRequest req) {
        notificationService.registerToken(userId, req.getToken());
        return Result.success(null);
    }

    @DeleteMapping("tokens")
    public Result<Void> unregister(@SessionAttribute("UID") String userId, @RequestBody PushTokenRequest req) {
        notificationService.unregisterToken(userId, req.getToken());
        return Result.success(null);
    }
}
