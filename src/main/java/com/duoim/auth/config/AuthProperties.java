package com.duoim.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 身份由上游网关完成校验，本服务只读取它转发的可信 userId。
 *
 * @param userIdHeader     上游注入 userId 的请求头名
 * @param allowQueryUserId 是否允许 WS 握手从 query 参数 userId 取身份（仅本地联调；生产必须关闭）
 */
@ConfigurationProperties(prefix = "im.auth")
public record AuthProperties(
        String userIdHeader,
        Boolean allowQueryUserId
) {

    public static final String DEFAULT_USER_ID_HEADER = "X-User-Id";

    public String userIdHeaderEffective() {
        if (userIdHeader == null || userIdHeader.isBlank()) {
            return DEFAULT_USER_ID_HEADER;
        }
        return userIdHeader.trim();
    }

    public boolean allowQueryUserIdEffective() {
        return allowQueryUserId != null && allowQueryUserId;
    }
}
