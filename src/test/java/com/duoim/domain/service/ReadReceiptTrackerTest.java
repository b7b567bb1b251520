package com.duoim.domain.service;

import com.duoim.DbTestSupport;
import com.duoim.common.exception.NotFoundException;
import com.duoim.domain.dto.MessagePayload;
import com.duoim.domain.dto.SeenReceipt;
import com.duoim.domain.entity.MessageEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadReceiptTrackerTest extends DbTestSupport {

    @Autowired
    private MessageStore messageStore;

    @Autowired
    private ReadReceiptTracker tracker;

    @Autowired
    private ChatListProjector projector;

    @Test
    void markSeen_ShouldFlipPeerMessagesOnceWithSharedTimestamp() {
        long a = newUser("A");
        long b = newUser("B");
        long chatId = newChat(a, b).getId();
        for (int i = 0; i < 3; i++) {
            messageStore.append(chatId, a, MessagePayload.text("m" + i));
        }
        messageStore.append(chatId, b, MessagePayload.text("mine"));
        assertThat(projector.unseenCount(chatId, b)).isEqualTo(3);

        SeenReceipt first = tracker.markSeen(chatId, b);
        SeenReceipt second = tracker.markSeen(chatId, b);

        assertThat(first.count()).isEqualTo(3);
        assertThat(first.seenAt()).isNotNull();
        assertThat(second.count()).isZero();
        assertThat(second.seenAt()).isNull();
        assertThat(second.changed()).isFalse();
        assertThat(projector.unseenCount(chatId, b)).isZero();

        List<MessageEntity> list = messageStore.listByChat(chatId);
        assertThat(list.subList(0, 3)).allSatisfy(m -> {
            assertThat(m.getSeen()).isTrue();
            assertThat(m.getSeenAt()).isEqualTo(first.seenAt());
        });
        // 自己发的消息不受自己的已读影响
        assertThat(list.get(3).getSeen()).isFalse();
        assertThat(projector.unseenCount(chatId, a)).isEqualTo(1);
    }

    @Test
    void markSeen_WithNothingPending_ShouldReturnZero() {
        long a = newUser("A");
        long chatId = newChat(a, newUser("B")).getId();

        SeenReceipt r = tracker.markSeen(chatId, a);

        assertThat(r.count()).isZero();
        assertThat(r.chatId()).isEqualTo(chatId);
        assertThat(r.viewerId()).isEqualTo(a);
    }

    @Test
    void concurrentAppendAndMarkSeen_ShouldKeepLogAndCountsConsistent() throws Exception {
        long a = newUser("A");
        long b = newUser("B");
        long chatId = newChat(a, b).getId();

        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < 30; i++) {
                messageStore.append(chatId, a, MessagePayload.text("w" + i));
            }
        });
        CompletableFuture<Integer> reader = CompletableFuture.supplyAsync(() -> {
            int flipped = 0;
            for (int i = 0; i < 30; i++) {
                flipped += tracker.markSeen(chatId, b).count();
            }
            return flipped;
        });
        writer.get(20, TimeUnit.SECONDS);
        int flipped = reader.get(20, TimeUnit.SECONDS);

        List<MessageEntity> list = messageStore.listByChat(chatId);
        assertThat(list).hasSize(30);
        assertThat(messageStore.latest(chatId).orElseThrow().getId()).isEqualTo(list.get(29).getId());
        long unseen = list.stream().filter(m -> !m.getSeen()).count();
        assertThat(unseen).isEqualTo(30 - flipped);
        assertThat(projector.unseenCount(chatId, b)).isEqualTo(unseen);
        assertThat(list).allSatisfy(m -> assertThat(m.getSeenAt() == null).isEqualTo(!m.getSeen()));
    }

    @Test
    void markSeen_WithUpperBound_ShouldLeaveLaterMessagesUnseen() {
        long a = newUser("A");
        long b = newUser("B");
        long chatId = newChat(a, b).getId();
        messageStore.append(chatId, a, MessagePayload.text("1"));
        messageStore.append(chatId, a, MessagePayload.text("2"));
        messageStore.append(chatId, a, MessagePayload.text("3"));

        SeenReceipt r = tracker.markSeen(chatId, b, 2L);

        assertThat(r.count()).isEqualTo(2);
        assertThat(messageStore.listByChat(chatId)).extracting(MessageEntity::getSeen).containsExactly(true, true, false);
        assertThat(projector.unseenCount(chatId, b)).isEqualTo(1);
    }

    @Test
    void markSeen_UnknownChat_ShouldThrowNotFound() {
        assertThatThrownBy(() -> tracker.markSeen(Long.MAX_VALUE - 11, 1L)).isInstanceOf(NotFoundException.class);
    }
}
