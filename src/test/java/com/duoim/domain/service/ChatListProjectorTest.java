package com.duoim.domain.service;

import com.duoim.DbTestSupport;
import com.duoim.domain.dto.ChatListEntryDto;
import com.duoim.domain.dto.MessagePayload;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChatListProjectorTest extends DbTestSupport {

    @Autowired
    private MessageStore messageStore;

    @Autowired
    private ReadReceiptTracker tracker;

    @Autowired
    private ChatListProjector projector;

    @Test
    void list_ShouldOrderByLatestMessageAndPutEmptyChatsLast() throws Exception {
        long me = newUser("Me");
        long bob = newUser("Bob");
        long carol = newUser("Carol");
        long dave = newUser("Dave");
        long withBob = newChat(me, bob).getId();
        long withCarol = newChat(me, carol).getId();
        long withDave = newChat(me, dave).getId();

        messageStore.append(withCarol, carol, MessagePayload.text("first"));
        TimeUnit.MILLISECONDS.sleep(5);
        messageStore.append(withBob, bob, MessagePayload.text("second"));

        List<ChatListEntryDto> list = projector.listForUser(me);
        assertThat(list).extracting(ChatListEntryDto::getChatId).containsExactly(withBob, withCarol, withDave);
        assertThat(list.get(0).getPeerUserId()).isEqualTo(bob);
        assertThat(list.get(0).getPeerDisplayName()).isEqualTo("Bob");
        assertThat(list.get(0).getLatestMessage().getPreview()).isEqualTo("second");
        assertThat(list.get(2).getLatestMessage()).isNull();

        // 新消息把会话顶到两个参与者列表的首位
        TimeUnit.MILLISECONDS.sleep(5);
        messageStore.append(withCarol, me, MessagePayload.text("third"));
        assertThat(projector.listForUser(me).get(0).getChatId()).isEqualTo(withCarol);
        assertThat(projector.listForUser(carol).get(0).getChatId()).isEqualTo(withCarol);
    }

    @Test
    void unseenCounts_ShouldTrackMessageLog() {
        long me = newUser("Me");
        long bob = newUser("Bob");
        long chatId = newChat(me, bob).getId();
        messageStore.append(chatId, bob, MessagePayload.text("1"));
        messageStore.append(chatId, bob, MessagePayload.text("2"));
        messageStore.append(chatId, me, MessagePayload.text("3"));

        assertThat(projector.listForUser(me).get(0).getUnseenCount()).isEqualTo(2);
        assertThat(projector.listForUser(bob).get(0).getUnseenCount()).isEqualTo(1);

        tracker.markSeen(chatId, me);

        assertThat(projector.listForUser(me).get(0).getUnseenCount()).isZero();
        assertThat(projector.listForUser(bob).get(0).getUnseenCount()).isEqualTo(1);
    }

    @Test
    void userWithoutChats_ShouldGetEmptyList() {
        assertThat(projector.listForUser(newUser("Lonely"))).isEmpty();
    }
}
