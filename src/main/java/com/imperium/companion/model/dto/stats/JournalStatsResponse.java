package com.imperium.companion.model.dto.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 日记统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalStatsResponse {

    private long total;
    private long totalWords;
    private long averageWords;
    private int longestEntry;
    private int currentStreak;
    private boolean journaledToday;
}
