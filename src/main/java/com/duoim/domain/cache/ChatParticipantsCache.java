package com.duoim.domain.cache;

import com.duoim.domain.config.CacheProperties;
import com.duoim.domain.entity.ChatEntity;
import com.duoim.domain.mapper.ChatMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * chatId -> 参与者。JOIN_CHAT / TYPING / 发送消息的成员校验都走这里，避免每帧查库。
 *
 * <p>不存在的会话不缓存（Caffeine 的 mapping function 返回 null 时不会写入）。</p>
 */
@Slf4j
@Component
public class ChatParticipantsCache {

    private final ChatMapper chatMapper;
    private final boolean enabled;
    private final Cache<Long, ChatParticipants> cache;

    public ChatParticipantsCache(ChatMapper chatMapper, CacheProperties props) {
        this.chatMapper = chatMapper;
        CacheProperties.ChatParticipants p = props.getChatParticipants();
        this.enabled = p.isEnabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, p.getMaximumSize()))
                .expireAfterAccess(Duration.ofSeconds(Math.max(1, p.getExpireAfterAccessSeconds())))
                .build();
    }

    /**
     * @return 会话不存在时返回 null
     */
    public ChatParticipants get(long chatId) {
        if (!enabled) {
            return load(chatId);
        }
        return cache.get(chatId, this::load);
    }

    public void put(ChatEntity chat) {
        if (enabled && chat != null && chat.getId() != null) {
            cache.put(chat.getId(), ChatParticipants.of(chat));
        }
    }

    public boolean isParticipant(long chatId, long userId) {
        ChatParticipants p = get(chatId);
        return p != null && p.contains(userId);
    }

    private ChatParticipants load(Long chatId) {
        ChatEntity chat = chatMapper.selectById(chatId);
        if (chat == null) {
            log.debug("chat not found: chatId={}", chatId);
            return null;
        }
        return ChatParticipants.of(chat);
    }
}
