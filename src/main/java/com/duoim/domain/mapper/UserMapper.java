package com.duoim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.duoim.domain.entity.UserEntity;

public interface UserMapper extends BaseMapper<UserEntity> {
}
