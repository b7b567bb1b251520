package com.duoim.gateway.ws;

import com.duoim.domain.dto.MessageDto;
import com.duoim.domain.dto.SeenReceipt;
import com.duoim.gateway.session.ConnectionRegistry;
import com.duoim.gateway.session.PresenceListener;
import com.duoim.gateway.session.RoomManager;
import com.duoim.gateway.typing.TypingCoordinator;
import com.duoim.gateway.typing.TypingListener;
import io.netty.channel.Channel;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * 领域事件 -> WS 推送。
 *
 * <ul>
 *   <li>在线状态边沿：ONLINE_USERS 全量快照发给所有连接（快照在发送时计算，最后一次推送总是最新状态）。</li>
 *   <li>输入状态：USER_TYPING / USER_STOPPED_TYPING 发给房间，排除发起连接。</li>
 *   <li>NEW_MESSAGE / MESSAGES_SEEN 发给房间所有连接。</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsEventPublisher implements PresenceListener, TypingListener {

    private final ConnectionRegistry connectionRegistry;
    private final RoomManager roomManager;
    private final TypingCoordinator typingCoordinator;
    private final WsWriter wsWriter;

    @PostConstruct
    void subscribe() {
        connectionRegistry.addPresenceListener(this);
        typingCoordinator.addListener(this);
    }

    @Override
    public void onPresenceChanged(long userId, boolean online) {
        String json = wsWriter.encode(onlineUsers());
        int n = 0;
        for (Channel ch : connectionRegistry.allConnections()) {
            if (ch.isActive()) {
                wsWriter.writeText(ch, json);
                n++;
            }
        }
        log.debug("ONLINE_USERS pushed: userId={}, online={}, connections={}", userId, online, n);
    }

    public void sendOnlineUsersTo(Channel ch) {
        wsWriter.write(ch, onlineUsers());
    }

    @Override
    public void onUserTyping(long chatId, long userId, Channel origin) {
        WsEnvelope env = WsEnvelope.of(WsFrameTypes.USER_TYPING, chatId);
        env.userId = userId;
        roomManager.broadcast(chatId, env, origin);
    }

    @Override
    public void onUserStoppedTyping(long chatId, long userId, Channel origin) {
        WsEnvelope env = WsEnvelope.of(WsFrameTypes.USER_STOPPED_TYPING, chatId);
        env.userId = userId;
        roomManager.broadcast(chatId, env, origin);
    }

    public int publishNewMessage(MessageDto message) {
        WsEnvelope env = WsEnvelope.of(WsFrameTypes.NEW_MESSAGE, message.getChatId());
        env.message = message;
        return roomManager.broadcast(message.getChatId(), env);
    }

    public int publishMessagesSeen(SeenReceipt receipt) {
        WsEnvelope env = WsEnvelope.of(WsFrameTypes.MESSAGES_SEEN, receipt.chatId());
        env.userId = receipt.viewerId();
        env.seenAt = receipt.seenAt();
        return roomManager.broadcast(receipt.chatId(), env);
    }

    private WsEnvelope onlineUsers() {
        WsEnvelope env = WsEnvelope.of(WsFrameTypes.ONLINE_USERS);
        env.userIds = new ArrayList<>(connectionRegistry.snapshotOnlineUsers());
        return env;
    }
}
