package com.imperium.companion.model.dto.stats;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * check_ins 聚合查询结果。
 */
@Data
@NoArgsConstructor
public class CheckInAggregate {

    private Long total;
    private Double averageSleep;
    private Double averageEnergy;
}
