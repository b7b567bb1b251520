package com.duoim.domain.service;

import com.duoim.domain.dto.ChatDto;
import com.duoim.domain.dto.ChatListEntryDto;
import com.duoim.domain.dto.MessageDto;
import com.duoim.domain.dto.MessagePayload;
import com.duoim.domain.dto.SeenReceipt;
import io.netty.channel.Channel;

import java.util.List;
import java.util.Set;

/**
 * 对外的消息能力入口：REST 控制器与 WS 帧处理都只调用这里。
 *
 * <p>错误以 {@link com.duoim.common.exception.ImException} 子类抛出，由调用方翻译成 HTTP 响应或 ERROR 帧。</p>
 */
public interface MessagingFacade {

    ChatDto createOrGetChat(long callerId, Long otherUserId);

    List<ChatListEntryDto> listChats(long callerId);

    default MessageDto sendMessage(long callerId, long chatId, MessagePayload payload) {
        return sendMessage(callerId, chatId, payload, null);
    }

    /**
     * 提交后向会话房间广播 NEW_MESSAGE；clientMsgId 命中幂等时返回原消息且不再广播。
     */
    MessageDto sendMessage(long callerId, long chatId, MessagePayload payload, String clientMsgId);

    /**
     * 返回全部历史（已读翻转之前的状态），然后执行 markSeen。
     */
    List<MessageDto> fetchMessages(long callerId, long chatId);

    SeenReceipt markSeen(long callerId, long chatId);

    Set<Long> onlineUsers();

    void connect(long userId, Channel ch);

    void disconnect(Channel ch);

    void joinChat(long userId, long chatId, Channel ch);

    void leaveChat(long chatId, Channel ch);

    void typing(long userId, long chatId, Channel ch);

    void stopTyping(long userId, long chatId);
}
