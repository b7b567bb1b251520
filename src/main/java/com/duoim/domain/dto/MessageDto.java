package com.duoim.domain.dto;

import com.duoim.domain.entity.MessageEntity;
import com.duoim.domain.enums.MessageType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对外的消息结构（HTTP 返回与 NEW_MESSAGE 推送共用）。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageDto {

    private Long id;

    private Long chatId;

    private Long senderId;

    private Long msgSeq;

    /** text / image */
    private String kind;

    private String text;

    private ImageRef image;

    private boolean seen;

    private LocalDateTime seenAt;

    private LocalDateTime createdAt;

    public static MessageDto from(MessageEntity m) {
        MessageDto dto = new MessageDto();
        dto.setId(m.getId());
        dto.setChatId(m.getChatId());
        dto.setSenderId(m.getSenderId());
        dto.setMsgSeq(m.getMsgSeq());
        if (m.getMsgType() == MessageType.IMAGE) {
            dto.setKind(MessageType.IMAGE.getDesc());
            dto.setImage(new ImageRef(m.getImageUrl(), m.getImageObjectId()));
        } else {
            dto.setKind(MessageType.TEXT.getDesc());
            dto.setText(m.getContent());
        }
        dto.setSeen(Boolean.TRUE.equals(m.getSeen()));
        dto.setSeenAt(m.getSeenAt());
        dto.setCreatedAt(m.getCreatedAt());
        return dto;
    }
}
