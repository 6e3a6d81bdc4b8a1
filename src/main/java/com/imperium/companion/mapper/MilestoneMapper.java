package com.imperium.companion.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.companion.model.dto.stats.MilestoneAggregate;
import com.imperium.companion.model.entity.Milestone;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface MilestoneMapper extends BaseMapper<Milestone> {

    @Select("SELECT COUNT(*) AS total, "
            + "SUM(CASE WHEN unlocked THEN 1 ELSE 0 END) AS unlocked, "
            + "AVG(progress) AS average_progress "
            + "FROM milestones WHERE user_id = #{userId}")
    MilestoneAggregate aggregate(@Param("userId") String userId);
}
