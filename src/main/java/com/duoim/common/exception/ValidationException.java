package com.duoim.common.exception;

import com.duoim.common.api.ApiCodes;

/** 请求或消息体不合法，未发生任何状态变更。 */
public class ValidationException extends ImException {

    public ValidationException(String reason) {
        super(ApiCodes.BAD_REQUEST, reason);
    }
}
