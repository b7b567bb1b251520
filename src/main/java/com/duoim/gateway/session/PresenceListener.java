package com.duoim.gateway.session;

/**
 * 在线状态边沿回调：只在 0->1（上线）和 N->0（下线）时触发。
 */
public interface PresenceListener {

    void onPresenceChanged(long userId, boolean online);
}
