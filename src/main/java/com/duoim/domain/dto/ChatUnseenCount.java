package com.duoim.domain.dto;

import lombok.Data;

/**
 * 按会话聚合的未读数（{@code MessageMapper#selectUnseenCounts} 的结果行）。
 */
@Data
public class ChatUnseenCount {

    private Long chatId;

    private Long unseenCount;
}
