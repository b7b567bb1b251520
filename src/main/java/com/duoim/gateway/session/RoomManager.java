package com.duoim.gateway.session;

import com.duoim.gateway.ws.WsEnvelope;
import com.duoim.gateway.ws.WsWriter;
import io.netty.channel.Channel;
import io.netty.util.Attribute;
import io.netty.util.AttributeKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 会话房间：chatId -> 当前打开了该会话的连接。与在线状态无关。
 *
 * <p>每个连接在 channel attribute 上记录自己加入的房间，断开时 {@link #leaveAll} 一次性清理。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomManager {

    private static final AttributeKey<Set<Long>> ATTR_ROOMS = AttributeKey.valueOf("duoim:rooms");

    private final ConcurrentHashMap<Long, Set<Channel>> rooms = new ConcurrentHashMap<>();
    private final WsWriter wsWriter;

    /**
     * @return false 表示已经在房间里，或连接已关闭
     */
    public boolean join(Channel ch, long chatId) {
        boolean[] added = new boolean[1];
        rooms.compute(chatId, (k, set) -> {
            if (set == null) {
                set = ConcurrentHashMap.newKeySet();
            }
            added[0] = set.add(ch);
            return set;
        });
        roomsOf(ch).add(chatId);
        if (!ch.isActive()) {
            // JOIN_CHAT 在 DB 线程上完成时连接可能已断开，leaveAll 已经执行过
            leave(ch, chatId);
            log.debug("room join dropped, channel closed: chatId={}, channel={}", chatId, ch);
            return false;
        }
        if (added[0]) {
            log.debug("room joined: chatId={}, channel={}", chatId, ch);
        }
        return added[0];
    }

    /**
     * @return false 表示本来就不在房间里
     */
    public boolean leave(Channel ch, long chatId) {
        boolean[] removed = new boolean[1];
        rooms.computeIfPresent(chatId, (k, set) -> {
            removed[0] = set.remove(ch);
            return set.isEmpty() ? null : set;
        });
        roomsOf(ch).remove(chatId);
        if (removed[0]) {
            log.debug("room left: chatId={}, channel={}", chatId, ch);
        }
        return removed[0];
    }

    public void leaveAll(Channel ch) {
        for (Long chatId : new ArrayList<>(roomsOf(ch))) {
            leave(ch, chatId);
        }
    }

    public Set<Channel> members(long chatId) {
        Set<Channel> set = rooms.get(chatId);
        return set == null ? Set.of() : new HashSet<>(set);
    }

    public Set<Long> roomsOf(Channel ch) {
        Attribute<Set<Long>> attr = ch.attr(ATTR_ROOMS);
        Set<Long> existing = attr.get();
        if (existing != null) {
            return existing;
        }
        Set<Long> created = ConcurrentHashMap.newKeySet();
        Set<Long> raced = attr.setIfAbsent(created);
        return raced == null ? created : raced;
    }

    public int broadcast(long chatId, WsEnvelope env) {
        return broadcast(chatId, env, null);
    }

    /**
     * 尽力投递：不确认、不重试。已关闭或不可写的成员记录 debug 日志后跳过，错误不会抛给调用方。
     *
     * @return 实际尝试写出的连接数
     */
    public int broadcast(long chatId, WsEnvelope env, Channel excluded) {
        Set<Channel> set = rooms.get(chatId);
        if (set == null || set.isEmpty()) {
            return 0;
        }
        String json = wsWriter.encode(env);
        List<Channel> dead = new ArrayList<>();
        int attempted = 0;
        for (Channel ch : set) {
            if (ch == excluded) {
                continue;
            }
            if (!ch.isActive()) {
                dead.add(ch);
                log.debug("skip closed room member: chatId={}, type={}, channel={}", chatId, env.getType(), ch);
                continue;
            }
            if (!ch.isWritable()) {
                log.debug("skip unwritable room member: chatId={}, type={}, channel={}", chatId, env.getType(), ch);
                continue;
            }
            wsWriter.writeText(ch, json);
            attempted++;
        }
        for (Channel ch : dead) {
            leave(ch, chatId);
        }
        return attempted;
    }
}
