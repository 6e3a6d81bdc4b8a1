package com.imperium.companion.controller;

import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.model.dto.request.CreateMilestoneRequest;
import com.imperium.companion.model.dto.request.MilestoneProgressRequest;
import com.imperium.companion.model.dto.stats.MilestoneStatsResponse;
import com.imperium.companion.model.entity.Milestone;
import com.imperium.companion.service.MilestoneService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 里程碑与成就接口。
 */
@RestController
@RequestMapping("/api/v0/milestones")
@Tag(name = "Milestones", description = "里程碑与成就")
public class MilestoneController {

    private final MilestoneService milestoneService;

    public MilestoneController(MilestoneService milestoneService) {
        this.milestoneService = milestoneService;
    }

    @GetMapping
    @Operation(summary = "里程碑列表", description = "新的在前")
    public List<Milestone> list(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId) {
        return milestoneService.listForUser(RequestIdSupport.requireUserId(userId));
    }

    @PostMapping
    @Operation(summary = "创建里程碑", description = "progress 取值 0~100，同一类型每个用户仅一条")
    public ResponseEntity<Milestone> create(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Valid @RequestBody CreateMilestoneRequest body) {
        Milestone created = milestoneService.createMilestone(RequestIdSupport.requireUserId(userId),
                body.getType(), body.getName(), body.getDescription(), body.getProgress());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping("/{milestoneId}/progress")
    @Operation(summary = "更新进度", description = "进度达到 100 时自动解锁")
    public Milestone updateProgress(
            @Parameter(description = "里程碑 ID", required = true)
            @PathVariable String milestoneId,
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Valid @RequestBody MilestoneProgressRequest body) {
        return milestoneService.updateProgress(RequestIdSupport.requireUserId(userId), milestoneId, body.getProgress());
    }

    @PostMapping("/{milestoneId}/unlock")
    @Operation(summary = "解锁里程碑", description = "进度置为 100 并记录解锁时间")
    public Milestone unlock(
            @Parameter(description = "里程碑 ID", required = true)
            @PathVariable String milestoneId,
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId) {
        return milestoneService.unlock(RequestIdSupport.requireUserId(userId), milestoneId);
    }

    @GetMapping("/stats")
    @Operation(summary = "里程碑统计", description = "总数、已解锁、进行中、平均进度")
    public MilestoneStatsResponse stats(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId) {
        return milestoneService.stats(RequestIdSupport.requireUserId(userId));
    }
}
