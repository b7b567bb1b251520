package com.duoim.domain.service;

import com.duoim.common.exception.StoreUnavailableException;
import com.duoim.domain.cache.ChatParticipantsCache;
import com.duoim.domain.cache.ClientMsgIdIdempotency;
import com.duoim.domain.config.ChatProperties;
import com.duoim.domain.config.ClientMsgIdCaffeineProperties;
import com.duoim.domain.dto.MessagePayload;
import com.duoim.domain.mapper.ChatMapper;
import com.duoim.domain.mapper.MessageMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionTemplate;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * 会话成员查询（缓存未命中回源）失败时，写路径报可重试的 store_unavailable，而不是 500。
 */
class StoreLookupFailureTest {

    private final MessageMapper messageMapper = mock(MessageMapper.class);
    private final ChatMapper chatMapper = mock(ChatMapper.class);
    private final ChatParticipantsCache participantsCache = mock(ChatParticipantsCache.class);
    private final TransactionTemplate tx = mock(TransactionTemplate.class);
    private final ChatProperties chatProperties = new ChatProperties(null, null);
    private final ChatWriteLocks writeLocks = new ChatWriteLocks(chatProperties);

    @BeforeEach
    void databaseDown() {
        when(participantsCache.get(anyLong())).thenThrow(new DataAccessResourceFailureException("connection refused"));
    }

    @Test
    void append_ShouldReportStoreUnavailable() {
        MessageStore store = new MessageStore(messageMapper, chatMapper, participantsCache,
                new ClientMsgIdIdempotency(new ClientMsgIdCaffeineProperties()), writeLocks, tx, chatProperties);

        assertThatThrownBy(() -> store.append(1L, 2L, MessagePayload.text("hi")))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessage("store_unavailable");
        verifyNoInteractions(messageMapper, tx);
    }

    @Test
    void markSeen_ShouldReportStoreUnavailable() {
        ReadReceiptTracker tracker = new ReadReceiptTracker(messageMapper, participantsCache, writeLocks, tx);

        assertThatThrownBy(() -> tracker.markSeen(1L, 2L))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessage("store_unavailable");
        verifyNoInteractions(messageMapper, tx);
    }
}
