package com.imperium.companion.model.dto.stats;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * milestones 聚合查询结果。
 */
@Data
@NoArgsConstructor
public class MilestoneAggregate {

    private Long total;
    private Long unlocked;
    private Double averageProgress;
}
