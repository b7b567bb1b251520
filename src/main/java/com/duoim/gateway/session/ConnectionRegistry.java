package com.duoim.gateway.session;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 本机维护 userId -> 在线连接集合。一个用户可以有多个连接（多设备 / 多标签页）。
 *
 * <p>集合只在 {@link ConcurrentHashMap#compute} 里修改，因此 0->1 与 N->0 的边沿判断对同一用户是原子的。
 * 边沿事件在 compute 之外通知监听者。</p>
 *
 * <p>以 Channel 对象本身作为 key（不是 ChannelId）：同一进程里 ChannelId 不保证唯一。</p>
 */
@Slf4j
@Component
public class ConnectionRegistry {

    public static final AttributeKey<Long> ATTR_USER_ID = AttributeKey.valueOf("duoim:uid");

    private final ConcurrentHashMap<Long, Set<Channel>> userChannels = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Channel, Long> channelUsers = new ConcurrentHashMap<>();
    private final List<PresenceListener> listeners = new CopyOnWriteArrayList<>();

    public void addPresenceListener(PresenceListener listener) {
        listeners.add(listener);
    }

    /**
     * @return true 表示这是该用户的第一个连接（上线边沿）
     */
    public boolean register(long userId, Channel ch) {
        Long prev = channelUsers.putIfAbsent(ch, userId);
        if (prev != null) {
            if (prev != userId) {
                log.warn("channel already registered to another user: channel={}, userId={}, existing={}", ch, userId, prev);
            }
            return false;
        }
        ch.attr(ATTR_USER_ID).set(userId);

        boolean[] online = new boolean[1];
        userChannels.compute(userId, (k, set) -> {
            if (set == null) {
                set = ConcurrentHashMap.newKeySet();
            }
            online[0] = set.isEmpty();
            set.add(ch);
            return set;
        });
        log.info("connection registered: userId={}, channel={}, online={}", userId, ch, online[0]);
        if (online[0]) {
            fire(userId, true);
        }
        return online[0];
    }

    /**
     * 未注册或已注销的连接直接忽略。
     *
     * @return true 表示这是该用户的最后一个连接（下线边沿）
     */
    public boolean unregister(Channel ch) {
        Long userId = channelUsers.remove(ch);
        if (userId == null) {
            return false;
        }
        boolean[] offline = new boolean[1];
        userChannels.computeIfPresent(userId, (k, set) -> {
            set.remove(ch);
            if (set.isEmpty()) {
                offline[0] = true;
                return null;
            }
            return set;
        });
        log.info("connection unregistered: userId={}, channel={}, offline={}", userId, ch, offline[0]);
        if (offline[0]) {
            fire(userId, false);
        }
        return offline[0];
    }

    public boolean isOnline(long userId) {
        Set<Channel> set = userChannels.get(userId);
        return set != null && !set.isEmpty();
    }

    /** 升序的在线用户快照。 */
    public Set<Long> snapshotOnlineUsers() {
        Set<Long> out = new TreeSet<>();
        userChannels.forEach((userId, set) -> {
            if (!set.isEmpty()) {
                out.add(userId);
            }
        });
        return out;
    }

    public int connectionCount(long userId) {
        Set<Channel> set = userChannels.get(userId);
        return set == null ? 0 : set.size();
    }

    public Long userIdOf(Channel ch) {
        return channelUsers.get(ch);
    }

    public Collection<Channel> allConnections() {
        return new ArrayList<>(channelUsers.keySet());
    }

    private void fire(long userId, boolean online) {
        log.info("presence changed: userId={}, online={}", userId, online);
        for (PresenceListener l : listeners) {
            try {
                l.onPresenceChanged(userId, online);
            } catch (RuntimeException e) {
                log.warn("presence listener failed: userId={}, online={}", userId, online, e);
            }
        }
    }
}
