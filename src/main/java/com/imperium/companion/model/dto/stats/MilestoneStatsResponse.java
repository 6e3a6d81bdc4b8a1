package com.imperium.companion.model.dto.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MilestoneStatsResponse {

    private long total;
    private long unlocked;
    private long inProgress;
    /** 平均进度，取整 */
    private long percentageComplete;
}
