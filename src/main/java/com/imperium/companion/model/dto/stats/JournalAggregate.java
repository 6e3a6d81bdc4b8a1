package com.imperium.companion.model.dto.stats;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * journal_entries 聚合查询结果。
 */
@Data
@NoArgsConstructor
public class JournalAggregate {

    private Long total;
    private Long totalWords;
    private Double averageWords;
    private Integer longestEntry;
}
