package com.duoim.gateway.typing;

import io.netty.channel.Channel;

/**
 * 输入状态边沿回调。origin 是最后一次驱动该状态的连接，广播时排除它。
 */
public interface TypingListener {

    void onUserTyping(long chatId, long userId, Channel origin);

    void onUserStoppedTyping(long chatId, long userId, Channel origin);
}
