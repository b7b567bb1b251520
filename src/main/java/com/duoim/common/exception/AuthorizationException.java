package com.duoim.common.exception;

import com.duoim.common.api.ApiCodes;

/**
 * 调用方不是会话参与者。
 *
 * <p>会话不存在时也抛这个异常（同一个 reason），不向非参与者暴露会话是否存在。</p>
 */
public class AuthorizationException extends ImException {

    public static final String NOT_CHAT_PARTICIPANT = "not_chat_participant";

    public AuthorizationException() {
        super(ApiCodes.FORBIDDEN, NOT_CHAT_PARTICIPANT);
    }
}
