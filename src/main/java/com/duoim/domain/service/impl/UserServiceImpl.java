package com.duoim.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.duoim.domain.entity.UserEntity;
import com.duoim.domain.mapper.UserMapper;
import com.duoim.domain.service.UserService;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class UserServiceImpl extends ServiceImpl<UserMapper, UserEntity> implements UserService {

    @Override
    public boolean exists(long userId) {
        return this.count(new LambdaQueryWrapper<UserEntity>().eq(UserEntity::getId, userId)) > 0;
    }

    @Override
    public Map<Long, String> displayNames(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return Map.of();
        }
        List<UserEntity> users = this.listByIds(userIds);
        Map<Long, String> out = new HashMap<>();
        for (UserEntity u : users) {
            String name = u.getDisplayName();
            if (name == null || name.isBlank()) {
                name = u.getUsername();
            }
            out.put(u.getId(), name);
        }
        return out;
    }
}
