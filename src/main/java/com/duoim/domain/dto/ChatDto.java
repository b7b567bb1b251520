package com.duoim.domain.dto;

import com.duoim.domain.entity.ChatEntity;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class ChatDto {

    private Long chatId;

    /** 两个参与者，升序。 */
    private List<Long> participantIds;

    /** 无消息时为 null */
    private LatestMessageDto latestMessage;

    private LocalDateTime updatedAt;

    public static ChatDto from(ChatEntity chat) {
        ChatDto dto = new ChatDto();
        dto.setChatId(chat.getId());
        dto.setParticipantIds(List.of(chat.getUser1Id(), chat.getUser2Id()));
        dto.setLatestMessage(LatestMessageDto.of(chat));
        dto.setUpdatedAt(chat.getUpdatedAt());
        return dto;
    }
}
