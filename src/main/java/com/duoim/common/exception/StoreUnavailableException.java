package com.duoim.common.exception;

import com.duoim.common.api.ApiCodes;

/**
 * 存储层失败（会话写锁等待超时、DB 异常）。整个操作已回滚，调用方决定是否重试。
 */
public class StoreUnavailableException extends ImException {

    public StoreUnavailableException(String reason) {
        super(ApiCodes.STORE_UNAVAILABLE, reason);
    }

    public StoreUnavailableException(String reason, Throwable cause) {
        super(ApiCodes.STORE_UNAVAILABLE, reason, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
