package com.duoim.domain.cache;

import com.duoim.domain.entity.ChatEntity;

/**
 * 会话的两个参与者（user1Id &lt; user2Id）。会话创建后不可变，可以放心缓存。
 */
public record ChatParticipants(long chatId, long user1Id, long user2Id) {

    public static ChatParticipants of(ChatEntity chat) {
        return new ChatParticipants(chat.getId(), chat.getUser1Id(), chat.getUser2Id());
    }

    public boolean contains(long userId) {
        return user1Id == userId || user2Id == userId;
    }

    public long peerOf(long userId) {
        return user1Id == userId ? user2Id : user1Id;
    }
}
