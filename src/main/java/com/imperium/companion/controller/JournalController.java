package com.imperium.companion.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.model.dto.request.CreateJournalRequest;
import com.imperium.companion.model.dto.request.JournalInsightsRequest;
import com.imperium.companion.model.dto.request.UpdateJournalRequest;
import com.imperium.companion.model.dto.response.JournalEntryResponse;
import com.imperium.companion.model.dto.stats.JournalStatsResponse;
import com.imperium.companion.model.entity.JournalEntry;
import com.imperium.companion.service.JournalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 日记接口：列表/搜索、创建、修改、删除、AI 洞察、统计。
 */
@RestController
@RequestMapping("/api/v0/journal")
@Tag(name = "Journal", description = "日记")
public class JournalController {

    private static final Logger log = LoggerFactory.getLogger(JournalController.class);

    private static final int LIST_LIMIT = 50;

    private final JournalService journalService;
    private final ObjectMapper objectMapper;

    public JournalController(JournalService journalService, ObjectMapper objectMapper) {
        this.journalService = journalService;
        this.objectMapper = objectMapper;
    }

    @GetMapping
    @Operation(summary = "日记列表", description = "新的在前；带 q 时按标题与正文模糊搜索")
    public List<JournalEntryResponse> list(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Parameter(description = "搜索关键字")
            @RequestParam(required = false) String q) {
        String owner = RequestIdSupport.requireUserId(userId);
        List<JournalEntry> entries = q != null && !q.isBlank()
                ? journalService.search(owner, q.trim(), LIST_LIMIT)
                : journalService.recent(owner, LIST_LIMIT);
        return entries.stream().map(this::toResponse).toList();
    }

    @PostMapping
    @Operation(summary = "创建日记", description = "正文至少 10 个字符")
    public ResponseEntity<JournalEntryResponse> create(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Valid @RequestBody CreateJournalRequest body) {
        JournalEntry entry = journalService.createEntry(RequestIdSupport.requireUserId(userId),
                body.getTitle(), body.getContent(), null);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(entry));
    }

    @PatchMapping("/{entryId}")
    @Operation(summary = "修改日记", description = "仅更新提供的字段，正文变化时重算字数")
    public JournalEntryResponse update(
            @Parameter(description = "日记 ID", required = true)
            @PathVariable String entryId,
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Valid @RequestBody UpdateJournalRequest body) {
        return toResponse(journalService.updateEntry(RequestIdSupport.requireUserId(userId),
                entryId, body.getTitle(), body.getContent()));
    }

    @DeleteMapping("/{entryId}")
    @Operation(summary = "删除日记")
    public ResponseEntity<Void> delete(
            @Parameter(description = "日记 ID", required = true)
            @PathVariable String entryId,
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId) {
        journalService.deleteEntry(RequestIdSupport.requireUserId(userId), entryId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{entryId}/insights")
    @Operation(summary = "写入 AI 洞察", description = "整体替换 ai_insights")
    public JournalEntryResponse updateInsights(
            @Parameter(description = "日记 ID", required = true)
            @PathVariable String entryId,
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId,
            @Valid @RequestBody JournalInsightsRequest body) {
        return toResponse(journalService.updateInsights(RequestIdSupport.requireUserId(userId),
                entryId, body.getInsights()));
    }

    @GetMapping("/stats")
    @Operation(summary = "日记统计", description = "总数、总字数、平均字数、最长条目、当前连续天数")
    public JournalStatsResponse stats(
            @Parameter(description = "用户标识", required = true)
            @RequestHeader(value = RequestIdSupport.HEADER_USER_ID, required = false) String userId) {
        return journalService.stats(RequestIdSupport.requireUserId(userId));
    }

    private JournalEntryResponse toResponse(JournalEntry entry) {
        return JournalEntryResponse.builder()
                .id(entry.getId())
                .title(entry.getTitle())
                .content(entry.getContent())
                .wordCount(entry.getWordCount())
                .insights(readInsights(entry))
                .createdAt(entry.getCreatedAt())
                .updatedAt(entry.getUpdatedAt())
                .build();
    }

    private Map<String, Object> readInsights(JournalEntry entry) {
        String json = entry.getAiInsightsJson();
        if (json == null || json.isBlank())
            return null;
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("Unreadable ai_insights on journal entry {}: {}", entry.getId(), e.getOriginalMessage());
            return null;
        }
    }
}
