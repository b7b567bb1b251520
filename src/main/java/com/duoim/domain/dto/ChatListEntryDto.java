package com.duoim.domain.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话列表中的一项（按查看者视角计算）。
 */
@Data
public class ChatListEntryDto {

    private Long chatId;

    private Long peerUserId;

    private String peerDisplayName;

    /** 无消息时为 null */
    private LatestMessageDto latestMessage;

    /** 对端发来、查看者尚未读的消息数 */
    private long unseenCount;

    private LocalDateTime updatedAt;
}
