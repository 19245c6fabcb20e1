package com.jz.hive.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.hive.domain.entity.Conversation;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ConversationMapper extends BaseMapper<Conversation> {
}
