package com.imperium.companion.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.companion.model.dto.stats.CheckInAggregate;
import com.imperium.companion.model.entity.CheckIn;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface CheckInMapper extends BaseMapper<CheckIn> {

    /** 有签到的自然日，倒序去重 */
    @Select("SELECT DISTINCT CAST(created_at AS DATE) AS activity_day FROM check_ins "
            + "WHERE user_id = #{userId} ORDER BY activity_day DESC")
    List<LocalDate> selectActivityDays(@Param("userId") String userId);

    @Select("SELECT COUNT(*) AS total, AVG(sleep_quality) AS average_sleep, AVG(energy_level) AS average_energy "
            + "FROM check_ins WHERE user_id = #{userId}")
    CheckInAggregate aggregate(@Param("userId") String userId);

    /** 出现次数最多的情绪 */
    @Select("SELECT mood FROM check_ins WHERE user_id = #{userId} "
            + "GROUP BY mood ORDER BY COUNT(*) DESC, mood ASC LIMIT 1")
    String selectMostCommonMood(@Param("userId") String userId);
}
