package com.duoim.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.duoim.domain.entity.UserEntity;

import java.util.Collection;
import java.util.Map;

public interface UserService extends IService<UserEntity> {

    boolean exists(long userId);

    /**
     * userId -> 展示名（displayName 为空时回退到 username）。不存在的用户不出现在结果里。
     */
    Map<Long, String> displayNames(Collection<Long> userIds);
}
