package com.duoim.domain.dto;

import com.duoim.domain.entity.ChatEntity;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话的最后一条消息摘要（来自 t_chat 的冗余列，无需回查 t_message）。
 */
@Data
public class LatestMessageDto {

    private Long messageId;

    private String kind;

    /** 文本为正文，图片为 url。 */
    private String preview;

    private Long senderId;

    private LocalDateTime createdAt;

    /**
     * @return 会话还没有消息时返回 null
     */
    public static LatestMessageDto of(ChatEntity chat) {
        if (chat.getLatestMessageId() == null) {
            return null;
        }
        LatestMessageDto dto = new LatestMessageDto();
        dto.setMessageId(chat.getLatestMessageId());
        dto.setKind(chat.getLatestMsgType() == null ? null : chat.getLatestMsgType().getDesc());
        dto.setPreview(chat.getLatestPreview());
        dto.setSenderId(chat.getLatestSenderId());
        dto.setCreatedAt(chat.getLatestAt());
        return dto;
    }
}
