package com.duoim.domain.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SendMessageRequest {

    private String text;

    private ImageRef image;

    /** 客户端幂等 key（可选）：同一发送者重试同一个 clientMsgId 只会落库一次。 */
    @Size(max = 64, message = "client_msg_id_too_long")
    private String clientMsgId;

    public MessagePayload toPayload() {
        return new MessagePayload(text, image);
    }
}
