package com.duoim.domain.service;

import com.duoim.domain.dto.ChatListEntryDto;
import com.duoim.domain.dto.LatestMessageDto;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatListOrderTest {

    private static final LocalDateTime T = LocalDateTime.of(2024, 5, 1, 12, 0, 0, 7_000_000);

    private static ChatListEntryDto entry(long chatId, Long latestMessageId, LocalDateTime latestAt) {
        ChatListEntryDto e = new ChatListEntryDto();
        e.setChatId(chatId);
        e.setUpdatedAt(latestAt == null ? T.minusDays(1) : latestAt);
        if (latestMessageId != null) {
            LatestMessageDto m = new LatestMessageDto();
            m.setMessageId(latestMessageId);
            m.setCreatedAt(latestAt);
            e.setLatestMessage(m);
        }
        return e;
    }

    @Test
    void sameMillisecond_ShouldPutLaterMessageFirstRegardlessOfChatId() {
        // 高 chatId 的会话先收到消息（消息 id 更小），低 chatId 的会话在同一毫秒后收到
        List<ChatListEntryDto> list = new ArrayList<>(List.of(
                entry(900L, 5_000L, T),
                entry(100L, 5_001L, T)));

        list.sort(ChatListProjector.ORDER);

        assertThat(list).extracting(ChatListEntryDto::getChatId).containsExactly(100L, 900L);
    }

    @Test
    void chatsWithoutMessages_ShouldFollowThoseWithMessages() {
        List<ChatListEntryDto> list = new ArrayList<>(List.of(
                entry(3L, null, null),
                entry(1L, 10L, T.minusSeconds(5)),
                entry(2L, 11L, T)));

        list.sort(ChatListProjector.ORDER);

        assertThat(list).extracting(ChatListEntryDto::getChatId).containsExactly(2L, 1L, 3L);
    }
}
