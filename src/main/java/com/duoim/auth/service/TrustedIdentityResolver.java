package com.duoim.auth.service;

import com.duoim.auth.config.AuthProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 解析上游网关转发的可信身份。HTTP 拦截器与 WS 握手共用。
 *
 * <p>这里不做任何签名校验：请求到达本服务时身份已经校验过，本服务只认正数 userId。</p>
 */
@Component
@EnableConfigurationProperties(AuthProperties.class)
public class TrustedIdentityResolver {

    private final AuthProperties props;

    public TrustedIdentityResolver(AuthProperties props) {
        this.props = props;
    }

    public String headerName() {
        return props.userIdHeaderEffective();
    }

    public boolean allowQueryUserId() {
        return props.allowQueryUserIdEffective();
    }

    /**
     * @return 合法的 userId；缺失或非法时返回 null
     */
    public Long parseUserId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            long v = Long.parseLong(raw.trim());
            return v > 0 ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
