package com.duoim.common.api;

/**
 * 统一错误码定义。前三位与 HTTP 状态码对齐，方便排查。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 消息体不合法 */
    public static final int BAD_REQUEST = 40000;

    /** 缺少可信身份头 */
    public static final int UNAUTHORIZED = 40100;

    /** 不是会话参与者 */
    public static final int FORBIDDEN = 40300;

    /** 会话 / 用户不存在，或路由不存在 */
    public static final int NOT_FOUND = 40400;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;

    /** 存储暂不可用（写锁等待超时 / DB 异常），调用方可重试 */
    public static final int STORE_UNAVAILABLE = 50300;
}
