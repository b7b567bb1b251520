package com.duoim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.duoim.domain.entity.ChatEntity;

public interface ChatMapper extends BaseMapper<ChatEntity> {
}
