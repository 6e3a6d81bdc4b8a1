package com.imperium.companion.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.companion.model.entity.Message;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface MessageMapper extends BaseMapper<Message> {
}
