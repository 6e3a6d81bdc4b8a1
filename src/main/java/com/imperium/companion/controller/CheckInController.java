package com.imperium.companion.controller;

import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.model.dto.request.CreateCheckInRequest;
import com.imperium.companion.model.dto.stats.CheckInStatsResponse;
import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.service.CheckInService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 每日签到接口。
 */
@RestController
@RequestMapping("/api/v0/check-ins")
@Tag(name = "Check-Ins", description = "每日签到")
public class CheckInController {

    private static final int LIST_LIMIT = 30;

    private final CheckInService checkInService;

    public CheckInController(CheckInService checkInService) {
        this.checkInService = checkInService;
    }

    @GetMapping
    @Operation(summary = "签到列表", description = "最近 30 条，新的在前")
    public List<CheckIn> list(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId) {
        return checkInService.recent(RequestIdSupport.requireUserId(userId), LIST_LIMIT);
    }

    @PostMapping
    @Operation(summary = "创建签到", description = "sleepQuality 与 energyLevel 取值 1~5")
    public ResponseEntity<CheckIn> create(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Valid @RequestBody CreateCheckInRequest body) {
        CheckIn created = checkInService.createCheckIn(RequestIdSupport.requireUserId(userId),
                body.getMood(), body.getSleepQuality(), body.getEnergyLevel(), body.getIntentions(), null);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/stats")
    @Operation(summary = "签到统计", description = "总数、最常见心情、平均睡眠/精力、当前连续天数")
    public CheckInStatsResponse stats(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId) {
        return checkInService.stats(RequestIdSupport.requireUserId(userId));
    }
}
