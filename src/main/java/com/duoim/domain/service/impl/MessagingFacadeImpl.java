package com.duoim.domain.service.impl;

import com.duoim.common.exception.AuthorizationException;
import com.duoim.common.exception.NotFoundException;
import com.duoim.common.exception.StoreUnavailableException;
import com.duoim.common.exception.ValidationException;
import com.duoim.domain.cache.ChatParticipants;
import com.duoim.domain.cache.ChatParticipantsCache;
import com.duoim.domain.dto.ChatDto;
import com.duoim.domain.dto.ChatListEntryDto;
import com.duoim.domain.dto.MessageDto;
import com.duoim.domain.dto.MessagePayload;
import com.duoim.domain.dto.SeenReceipt;
import com.duoim.domain.entity.ChatEntity;
import com.duoim.domain.entity.MessageEntity;
import com.duoim.domain.service.ChatListProjector;
import com.duoim.domain.service.ChatService;
import com.duoim.domain.service.MessageStore;
import com.duoim.domain.service.MessagingFacade;
import com.duoim.domain.service.ReadReceiptTracker;
import com.duoim.domain.service.UserService;
import com.duoim.gateway.session.ConnectionRegistry;
import com.duoim.gateway.session.RoomManager;
import com.duoim.gateway.typing.TypingCoordinator;
import com.duoim.gateway.ws.WsEventPublisher;
import io.netty.channel.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessagingFacadeImpl implements MessagingFacade {

    private final ChatService chatService;
    private final UserService userService;
    private final ChatParticipantsCache participantsCache;
    private final MessageStore messageStore;
    private final ReadReceiptTracker readReceiptTracker;
    private final ChatListProjector chatListProjector;
    private final ConnectionRegistry connectionRegistry;
    private final RoomManager roomManager;
    private final TypingCoordinator typingCoordinator;
    private final WsEventPublisher eventPublisher;

    @Override
    public ChatDto createOrGetChat(long callerId, Long otherUserId) {
        if (otherUserId == null || otherUserId <= 0) {
            throw new ValidationException("missing_other_user_id");
        }
        if (otherUserId == callerId) {
            throw new ValidationException("cannot_chat_with_self");
        }
        try {
            if (!userService.exists(callerId) || !userService.exists(otherUserId)) {
                throw new NotFoundException("user_not_found");
            }
            ChatEntity chat = chatService.getOrCreate(callerId, otherUserId);
            participantsCache.put(chat);
            return ChatDto.from(chat);
        } catch (DataAccessException e) {
            log.warn("createOrGetChat failed: callerId={}, otherUserId={}, err={}", callerId, otherUserId, e.toString());
            throw new StoreUnavailableException("store_unavailable", e);
        }
    }

    @Override
    public List<ChatListEntryDto> listChats(long callerId) {
        return chatListProjector.listForUser(callerId);
    }

    @Override
    public MessageDto sendMessage(long callerId, long chatId, MessagePayload payload, String clientMsgId) {
        requireParticipant(callerId, chatId);
        MessageStore.Appended appended = messageStore.append(chatId, callerId, payload, clientMsgId);
        MessageDto dto = MessageDto.from(appended.message());
        if (!appended.duplicate()) {
            eventPublisher.publishNewMessage(dto);
        }
        return dto;
    }

    @Override
    public List<MessageDto> fetchMessages(long callerId, long chatId) {
        requireParticipant(callerId, chatId);
        List<MessageEntity> rows = messageStore.listByChat(chatId);
        List<MessageDto> out = new ArrayList<>(rows.size());
        for (MessageEntity m : rows) {
            out.add(MessageDto.from(m));
        }
        if (!rows.isEmpty()) {
            // 只标记已经返回给调用方的部分，拉取之后到达的消息留给下一次
            seen(chatId, callerId, rows.get(rows.size() - 1).getMsgSeq());
        }
        return out;
    }

    @Override
    public SeenReceipt markSeen(long callerId, long chatId) {
        requireParticipant(callerId, chatId);
        return seen(chatId, callerId, Long.MAX_VALUE);
    }

    @Override
    public Set<Long> onlineUsers() {
        return connectionRegistry.snapshotOnlineUsers();
    }

    @Override
    public void connect(long userId, Channel ch) {
        boolean online = connectionRegistry.register(userId, ch);
        if (!online) {
            // 上线边沿已经向所有连接（包括这个）推过快照
            eventPublisher.sendOnlineUsersTo(ch);
        }
    }

    @Override
    public void disconnect(Channel ch) {
        typingCoordinator.onDisconnect(ch);
        roomManager.leaveAll(ch);
        connectionRegistry.unregister(ch);
    }

    @Override
    public void joinChat(long userId, long chatId, Channel ch) {
        requireParticipant(userId, chatId);
        roomManager.join(ch, chatId);
    }

    @Override
    public void leaveChat(long chatId, Channel ch) {
        roomManager.leave(ch, chatId);
    }

    @Override
    public void typing(long userId, long chatId, Channel ch) {
        requireParticipant(userId, chatId);
        typingCoordinator.typing(chatId, userId, ch);
    }

    @Override
    public void stopTyping(long userId, long chatId) {
        typingCoordinator.stopTyping(chatId, userId);
    }

    private SeenReceipt seen(long chatId, long viewerId, long upToSeq) {
        SeenReceipt receipt = readReceiptTracker.markSeen(chatId, viewerId, upToSeq);
        if (receipt.changed()) {
            eventPublisher.publishMessagesSeen(receipt);
        }
        return receipt;
    }

    /**
     * 会话不存在与不是参与者返回同一个错误。
     */
    private void requireParticipant(long userId, long chatId) {
        ChatParticipants p;
        try {
            p = participantsCache.get(chatId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("store_unavailable", e);
        }
        if (p == null || !p.contains(userId)) {
            throw new AuthorizationException();
        }
    }
}
