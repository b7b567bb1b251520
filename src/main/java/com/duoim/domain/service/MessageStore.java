package com.duoim.domain.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.duoim.common.exception.NotFoundException;
import com.duoim.common.exception.StoreUnavailableException;
import com.duoim.common.exception.ValidationException;
import com.duoim.domain.cache.ChatParticipantsCache;
import com.duoim.domain.cache.ClientMsgIdIdempotency;
import com.duoim.domain.config.ChatProperties;
import com.duoim.domain.dto.ImageRef;
import com.duoim.domain.dto.MessagePayload;
import com.duoim.domain.entity.ChatEntity;
import com.duoim.domain.entity.MessageEntity;
import com.duoim.domain.enums.MessageType;
import com.duoim.domain.mapper.ChatMapper;
import com.duoim.domain.mapper.MessageMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 会话消息日志：只追加，按 msgSeq 升序读取。
 *
 * <p>追加流程（持有会话写锁，单个事务）：</p>
 * <ol>
 *   <li>读取会话行，分配 msgSeq = lastMsgSeq + 1，createdAt 不早于上一条消息。</li>
 *   <li>插入 t_message。</li>
 *   <li>以 lastMsgSeq 作为条件更新 t_chat 的 latest* / lastMsgSeq / updatedAt。</li>
 * </ol>
 */
@Slf4j
@Component
public class MessageStore {

    static final int PREVIEW_MAX_CHARS = 256;
    static final int MAX_IMAGE_URL_LENGTH = 1024;
    static final int MAX_IMAGE_OBJECT_ID_LENGTH = 256;

    private final MessageMapper messageMapper;
    private final ChatMapper chatMapper;
    private final ChatParticipantsCache participantsCache;
    private final ClientMsgIdIdempotency idempotency;
    private final ChatWriteLocks writeLocks;
    private final TransactionTemplate tx;
    private final int maxTextLength;

    public MessageStore(MessageMapper messageMapper,
                        ChatMapper chatMapper,
                        ChatParticipantsCache participantsCache,
                        ClientMsgIdIdempotency idempotency,
                        ChatWriteLocks writeLocks,
                        TransactionTemplate tx,
                        ChatProperties chatProps) {
        this.messageMapper = messageMapper;
        this.chatMapper = chatMapper;
        this.participantsCache = participantsCache;
        this.idempotency = idempotency;
        this.writeLocks = writeLocks;
        this.tx = tx;
        this.maxTextLength = chatProps.maxTextLengthEffective();
    }

    /**
     * 追加结果。duplicate=true 表示命中 clientMsgId 幂等，返回的是原先落库的消息，调用方不应再次广播。
     */
    public record Appended(MessageEntity message, boolean duplicate) {
    }

    public MessageEntity append(long chatId, long senderId, MessagePayload payload) {
        return append(chatId, senderId, payload, null).message();
    }

    public Appended append(long chatId, long senderId, MessagePayload payload, String clientMsgId) {
        validate(payload);
        requireChat(chatId);
        String idemKey = idempotency.key(senderId, clientMsgId);

        return writeLocks.withLock(chatId, () -> {
            Long existingId = idempotency.get(idemKey);
            if (existingId != null) {
                MessageEntity existing = store(() -> messageMapper.selectById(existingId));
                if (existing != null && existing.getChatId() == chatId) {
                    log.debug("append deduplicated: chatId={}, senderId={}, clientMsgId={}, messageId={}",
                            chatId, senderId, clientMsgId, existingId);
                    return new Appended(existing, true);
                }
            }
            MessageEntity saved = store(() -> tx.execute(status -> insertAndBump(chatId, senderId, payload)));
            idempotency.put(idemKey, saved.getId());
            log.debug("message appended: chatId={}, senderId={}, msgSeq={}, messageId={}",
                    chatId, senderId, saved.getMsgSeq(), saved.getId());
            return new Appended(saved, false);
        });
    }

    public List<MessageEntity> listByChat(long chatId) {
        return store(() -> messageMapper.selectList(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getChatId, chatId)
                .orderByAsc(MessageEntity::getMsgSeq)));
    }

    public Optional<MessageEntity> latest(long chatId) {
        List<MessageEntity> rows = store(() -> messageMapper.selectList(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getChatId, chatId)
                .orderByDesc(MessageEntity::getMsgSeq)
                .last("limit 1")));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private MessageEntity insertAndBump(long chatId, long senderId, MessagePayload payload) {
        ChatEntity chat = chatMapper.selectById(chatId);
        if (chat == null) {
            throw new NotFoundException("chat_not_found");
        }
        long expectedSeq = chat.getLastMsgSeq() == null ? 0L : chat.getLastMsgSeq();

        LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
        if (chat.getLatestAt() != null && chat.getLatestAt().isAfter(now)) {
            now = chat.getLatestAt();
        }

        MessageEntity m = new MessageEntity();
        m.setChatId(chatId);
        m.setSenderId(senderId);
        m.setMsgSeq(expectedSeq + 1);
        if (payload.image() != null) {
            m.setMsgType(MessageType.IMAGE);
            m.setImageUrl(payload.image().url().trim());
            m.setImageObjectId(payload.image().objectId().trim());
        } else {
            m.setMsgType(MessageType.TEXT);
            m.setContent(payload.text());
        }
        m.setSeen(false);
        m.setCreatedAt(now);
        messageMapper.insert(m);

        ChatEntity patch = new ChatEntity();
        patch.setLastMsgSeq(m.getMsgSeq());
        patch.setLatestMessageId(m.getId());
        patch.setLatestMsgType(m.getMsgType());
        patch.setLatestPreview(preview(m));
        patch.setLatestSenderId(senderId);
        patch.setLatestAt(now);
        patch.setUpdatedAt(now);
        int updated = chatMapper.update(patch, new LambdaUpdateWrapper<ChatEntity>()
                .eq(ChatEntity::getId, chatId)
                .eq(ChatEntity::getLastMsgSeq, expectedSeq));
        if (updated != 1) {
            // 持锁情况下不应发生；回滚本次插入
            throw new StoreUnavailableException("chat_write_conflict");
        }
        return m;
    }

    private void validate(MessagePayload payload) {
        if (payload == null) {
            throw new ValidationException("missing_content");
        }
        boolean hasText = payload.text() != null;
        ImageRef image = payload.image();
        boolean hasImage = image != null;
        if (hasText == hasImage) {
            throw new ValidationException(hasText ? "ambiguous_content" : "missing_content");
        }
        if (hasText) {
            if (payload.text().isBlank()) {
                throw new ValidationException("blank_text");
            }
            if (payload.text().length() > maxTextLength) {
                throw new ValidationException("text_too_long");
            }
            return;
        }
        if (image.url() == null || image.url().isBlank()) {
            throw new ValidationException("missing_image_url");
        }
        if (image.url().length() > MAX_IMAGE_URL_LENGTH) {
            throw new ValidationException("image_url_too_long");
        }
        if (image.objectId() == null || image.objectId().isBlank()) {
            throw new ValidationException("missing_image_object_id");
        }
        if (image.objectId().length() > MAX_IMAGE_OBJECT_ID_LENGTH) {
            throw new ValidationException("image_object_id_too_long");
        }
    }

    private void requireChat(long chatId) {
        if (store(() -> participantsCache.get(chatId)) == null) {
            throw new NotFoundException("chat_not_found");
        }
    }

    private static String preview(MessageEntity m) {
        String text = m.getMsgType() == MessageType.IMAGE ? m.getImageUrl() : m.getContent();
        if (text.length() <= PREVIEW_MAX_CHARS) {
            return text;
        }
        return text.substring(0, PREVIEW_MAX_CHARS);
    }

    /**
     * JDBC / 事务异常统一转成可重试的 StoreUnavailableException。
     */
    private <T> T store(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            log.warn("message store failure: {}", e.toString());
            throw new StoreUnavailableException("store_unavailable", e);
        }
    }
}
