package com.duoim.auth.web;

/**
 * 请求级别的“当前用户”上下文。
 *
 * <p>ThreadLocal 必须在请求结束时清理，否则线程复用时会串号；
 * 清理在 TrustedIdentityInterceptor#afterCompletion 里做。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Long> USER_ID = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setUserId(Long userId) {
        USER_ID.set(userId);
    }

    public static Long getUserId() {
        return USER_ID.get();
    }

    public static void clear() {
        USER_ID.remove();
    }
}
