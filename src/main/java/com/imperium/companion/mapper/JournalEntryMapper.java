package com.imperium.companion.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.companion.model.dto.stats.JournalAggregate;
import com.imperium.companion.model.entity.JournalEntry;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface JournalEntryMapper extends BaseMapper<JournalEntry> {

    /** 有日记的自然日，倒序去重 */
    @Select("SELECT DISTINCT CAST(created_at AS DATE) AS activity_day FROM journal_entries "
            + "WHERE user_id = #{userId} ORDER BY activity_day DESC")
    List<LocalDate> selectActivityDays(@Param("userId") String userId);

    @Select("SELECT COUNT(*) AS total, COALESCE(SUM(word_count), 0) AS total_words, "
            + "AVG(word_count) AS average_words, COALESCE(MAX(word_count), 0) AS longest_entry "
            + "FROM journal_entries WHERE user_id = #{userId}")
    JournalAggregate aggregate(@Param("userId") String userId);
}
