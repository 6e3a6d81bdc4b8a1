package com.imperium.companion.model.dto.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 签到统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckInStatsResponse {

    private long total;
    /** 出现最多的情绪，无记录时为 N/A */
    private String mostCommonMood;
    /** 保留一位小数 */
    private double averageSleep;
    private double averageEnergy;
    private int currentStreak;
    private boolean checkedInToday;
}
