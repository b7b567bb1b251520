package com.duoim.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.duoim.domain.entity.ChatEntity;

import java.util.List;

public interface ChatService extends IService<ChatEntity> {

    /**
     * 按无序用户对查找会话，不存在则创建。并发创建由唯一索引裁决，败者回读胜者的行。
     */
    ChatEntity getOrCreate(long userA, long userB);

    List<ChatEntity> listByUser(long userId);
}
