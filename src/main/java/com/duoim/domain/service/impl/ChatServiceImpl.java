package com.duoim.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.duoim.common.exception.StoreUnavailableException;
import com.duoim.domain.entity.ChatEntity;
import com.duoim.domain.mapper.ChatMapper;
import com.duoim.domain.service.ChatService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Slf4j
@Service
public class ChatServiceImpl extends ServiceImpl<ChatMapper, ChatEntity> implements ChatService {

    @Override
    public ChatEntity getOrCreate(long userA, long userB) {
        long user1Id = Math.min(userA, userB);
        long user2Id = Math.max(userA, userB);

        ChatEntity existing = findPair(user1Id, user2Id);
        if (existing != null) {
            return existing;
        }

        LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
        ChatEntity chat = new ChatEntity();
        chat.setUser1Id(user1Id);
        chat.setUser2Id(user2Id);
        chat.setLastMsgSeq(0L);
        chat.setCreatedAt(now);
        chat.setUpdatedAt(now);
        try {
            this.save(chat);
            log.info("chat created: chatId={}, user1Id={}, user2Id={}", chat.getId(), user1Id, user2Id);
            return chat;
        } catch (DuplicateKeyException e) {
            // 并发创建：对方已经插入成功
            ChatEntity winner = findPair(user1Id, user2Id);
            if (winner == null) {
                throw new StoreUnavailableException("store_unavailable", e);
            }
            return winner;
        }
    }

    @Override
    public List<ChatEntity> listByUser(long userId) {
        return this.list(new LambdaQueryWrapper<ChatEntity>()
                .eq(ChatEntity::getUser1Id, userId)
                .or()
                .eq(ChatEntity::getUser2Id, userId));
    }

    private ChatEntity findPair(long user1Id, long user2Id) {
        return this.getOne(new LambdaQueryWrapper<ChatEntity>()
                .eq(ChatEntity::getUser1Id, user1Id)
                .eq(ChatEntity::getUser2Id, user2Id));
    }
}
