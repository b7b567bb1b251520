package com.duoim.gateway.ws;

import com.duoim.domain.dto.MessageDto;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WsEnvelope {

    /**
     * 帧类型（路由字段）。
     *
     * <p>客户端 -> 服务端：TYPING / STOP_TYPING / JOIN_CHAT / LEAVE_CHAT / PING</p>
     * <p>服务端 -> 客户端：ONLINE_USERS / NEW_MESSAGE / MESSAGES_SEEN / USER_TYPING / USER_STOPPED_TYPING /
     * JOIN_OK / PONG / PING / ERROR</p>
     */
    public String type;

    public Long chatId;

    /** 事件主体用户。客户端帧里的值会被忽略，以握手绑定的身份为准。 */
    public Long userId;

    /** ONLINE_USERS 的全量快照。 */
    public List<Long> userIds;

    /** NEW_MESSAGE 携带的消息。 */
    public MessageDto message;

    /** MESSAGES_SEEN 的批次时间。 */
    public LocalDateTime seenAt;

    /** 时间戳（毫秒）。 */
    public Long ts;

    /** ERROR 原因。 */
    public String reason;

    public static WsEnvelope of(String type) {
        WsEnvelope env = new WsEnvelope();
        env.type = type;
        env.ts = System.currentTimeMillis();
        return env;
    }

    public static WsEnvelope of(String type, Long chatId) {
        WsEnvelope env = of(type);
        env.chatId = chatId;
        return env;
    }
}
