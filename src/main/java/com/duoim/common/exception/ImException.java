package com.duoim.common.exception;

/**
 * 业务异常基类：携带错误码与简短原因（reason 同时用作 HTTP message 与 WS ERROR 帧的 reason）。
 */
public abstract class ImException extends RuntimeException {

    private final int code;

    protected ImException(int code, String reason) {
        super(reason);
        this.code = code;
    }

    protected ImException(int code, String reason, Throwable cause) {
        super(reason, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public String getReason() {
        return getMessage();
    }

    /** 调用方是否可以原样重试。 */
    public boolean isRetryable() {
        return false;
    }
}
