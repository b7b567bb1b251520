package com.duoim.domain.service;

import com.duoim.common.exception.NotFoundException;
import com.duoim.common.exception.StoreUnavailableException;
import com.duoim.domain.cache.ChatParticipants;
import com.duoim.domain.cache.ChatParticipantsCache;
import com.duoim.domain.dto.SeenReceipt;
import com.duoim.domain.mapper.MessageMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 已读回执：把对端发来的所有未读消息一次性翻成已读，共享同一个 seenAt。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadReceiptTracker {

    private final MessageMapper messageMapper;
    private final ChatParticipantsCache participantsCache;
    private final ChatWriteLocks writeLocks;
    private final TransactionTemplate tx;

    /**
     * @return count 为 0 表示没有待翻转的消息（seenAt 为 null），调用方据此决定是否广播
     */
    public SeenReceipt markSeen(long chatId, long viewerId) {
        return markSeen(chatId, viewerId, Long.MAX_VALUE);
    }

    /**
     * 只翻转 msgSeq &lt;= upToSeq 的消息：拉历史后补标已读时，不能把拉取之后才到达的消息算作已读。
     */
    public SeenReceipt markSeen(long chatId, long viewerId, long upToSeq) {
        ChatParticipants participants;
        try {
            participants = participantsCache.get(chatId);
        } catch (DataAccessException e) {
            log.warn("markSeen chat lookup failed: chatId={}, err={}", chatId, e.toString());
            throw new StoreUnavailableException("store_unavailable", e);
        }
        if (participants == null) {
            throw new NotFoundException("chat_not_found");
        }
        return writeLocks.withLock(chatId, () -> {
            LocalDateTime seenAt = LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
            Integer count;
            try {
                count = tx.execute(status -> messageMapper.markSeen(chatId, viewerId, upToSeq, seenAt));
            } catch (DataAccessException | TransactionException e) {
                log.warn("markSeen failed: chatId={}, viewerId={}, err={}", chatId, viewerId, e.toString());
                throw new StoreUnavailableException("store_unavailable", e);
            }
            int n = count == null ? 0 : count;
            if (n > 0) {
                log.debug("messages seen: chatId={}, viewerId={}, count={}", chatId, viewerId, n);
            }
            return new SeenReceipt(chatId, viewerId, n, n > 0 ? seenAt : null);
        });
    }
}
