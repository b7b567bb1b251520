package com.duoim.gateway.ws;

public final class WsFrameTypes {

    public static final String PING = "PING";
    public static final String PONG = "PONG";
    public static final String JOIN_CHAT = "JOIN_CHAT";
    public static final String JOIN_OK = "JOIN_OK";
    public static final String LEAVE_CHAT = "LEAVE_CHAT";
    public static final String TYPING = "TYPING";
    public static final String STOP_TYPING = "STOP_TYPING";
    public static final String ONLINE_USERS = "ONLINE_USERS";
    public static final String NEW_MESSAGE = "NEW_MESSAGE";
    public static final String MESSAGES_SEEN = "MESSAGES_SEEN";
    public static final String USER_TYPING = "USER_TYPING";
    public static final String USER_STOPPED_TYPING = "USER_STOPPED_TYPING";
    public static final String ERROR = "ERROR";

    private WsFrameTypes() {
    }
}
