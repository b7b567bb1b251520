package com.duoim.domain.dto;

import java.time.LocalDateTime;

/**
 * 一次已读批处理的结果。count 为 0 时没有发生翻转，seenAt 为 null。
 */
public record SeenReceipt(long chatId, long viewerId, int count, LocalDateTime seenAt) {

    public boolean changed() {
        return count > 0;
    }
}
