package com.jz.hive.controller;

import com.jz.hive.common.Result;
import com.jz.hive.domain.entity.ModerationLog;
import com.jz.hive.guard.ModerationLedgerService;
import com.jz.hive.guard.ModerationStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("api/moderation")
@RequiredArgsConstructor
public class ModerationController {

    private final ModerationLedgerService ledgerService;

    @GetMapping("status")
    public Result<ModerationStatus> status(@SessionAttribute("UID") String userId) {
        return Result.success(ledgerService.status(userId));
    }

    /** 审计读取，新的在前；鉴权由管理端网关负责 */
    @GetMapping("logs")
    public Result<List<ModerationLog>> logs(@RequestParam(value = "userId", required = false) String userId,
                                            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return Result.success(ledgerService.recentLogs(userId, limit));
    }
}
