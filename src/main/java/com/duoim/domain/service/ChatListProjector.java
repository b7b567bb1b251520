package com.duoim.domain.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.duoim.common.exception.StoreUnavailableException;
import com.duoim.domain.dto.ChatListEntryDto;
import com.duoim.domain.dto.ChatUnseenCount;
import com.duoim.domain.dto.LatestMessageDto;
import com.duoim.domain.entity.ChatEntity;
import com.duoim.domain.entity.MessageEntity;
import com.duoim.domain.mapper.MessageMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 按查看者视角计算会话列表。每次读取时从 t_chat / t_message 重新计算，未读数不会和消息表产生偏差。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatListProjector {

    /**
     * 有消息的排前面（latestAt 倒序）。latestAt 只到毫秒，同一毫秒内按最后一条消息的雪花 id 倒序（后写入的更大）。
     * 无消息的按 updatedAt 倒序，最后按 chatId 倒序保证稳定。
     */
    static final Comparator<ChatListEntryDto> ORDER = Comparator
            .comparing((ChatListEntryDto e) -> e.getLatestMessage() == null ? null : e.getLatestMessage().getCreatedAt(),
                    Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing((ChatListEntryDto e) -> e.getLatestMessage() == null ? null : e.getLatestMessage().getMessageId(),
                    Comparator.nullsLast(Comparator.<Long>reverseOrder()))
            .thenComparing(ChatListEntryDto::getUpdatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(ChatListEntryDto::getChatId, Comparator.reverseOrder());

    private final ChatService chatService;
    private final UserService userService;
    private final MessageMapper messageMapper;

    public List<ChatListEntryDto> listForUser(long userId) {
        try {
            List<ChatEntity> chats = chatService.listByUser(userId);
            if (chats.isEmpty()) {
                return List.of();
            }

            List<Long> chatIds = chats.stream().map(ChatEntity::getId).collect(Collectors.toList());
            Map<Long, Long> unseen = new HashMap<>();
            for (ChatUnseenCount row : messageMapper.selectUnseenCounts(chatIds, userId)) {
                if (row.getChatId() != null && row.getUnseenCount() != null) {
                    unseen.put(row.getChatId(), row.getUnseenCount());
                }
            }
            Set<Long> peerIds = chats.stream().map(c -> c.peerOf(userId)).collect(Collectors.toSet());
            Map<Long, String> names = userService.displayNames(peerIds);

            List<ChatListEntryDto> out = new ArrayList<>(chats.size());
            for (ChatEntity chat : chats) {
                Long peerId = chat.peerOf(userId);
                ChatListEntryDto e = new ChatListEntryDto();
                e.setChatId(chat.getId());
                e.setPeerUserId(peerId);
                e.setPeerDisplayName(names.get(peerId));
                e.setLatestMessage(LatestMessageDto.of(chat));
                e.setUnseenCount(unseen.getOrDefault(chat.getId(), 0L));
                e.setUpdatedAt(chat.getUpdatedAt());
                out.add(e);
            }
            out.sort(ORDER);
            return out;
        } catch (DataAccessException e) {
            log.warn("listForUser failed: userId={}, err={}", userId, e.toString());
            throw new StoreUnavailableException("store_unavailable", e);
        }
    }

    public long unseenCount(long chatId, long viewerId) {
        try {
            Long n = messageMapper.selectCount(new LambdaQueryWrapper<MessageEntity>()
                    .eq(MessageEntity::getChatId, chatId)
                    .ne(MessageEntity::getSenderId, viewerId)
                    .eq(MessageEntity::getSeen, false));
            return n == null ? 0L : n;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("store_unavailable", e);
        }
    }
}
