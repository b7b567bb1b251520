package com.duoim.auth.web;

import com.duoim.auth.service.TrustedIdentityResolver;
import com.duoim.common.api.ApiCodes;
import com.duoim.common.api.Result;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 从可信身份头取 userId 放入 {@link AuthContext}；缺失或非法时直接 401（统一 Result JSON）。
 */
@Slf4j
@Component
public class TrustedIdentityInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER_ID = "X-Auth-UserId";

    private final TrustedIdentityResolver identityResolver;
    private final ObjectMapper objectMapper;

    public TrustedIdentityInterceptor(TrustedIdentityResolver identityResolver, ObjectMapper objectMapper) {
        this.identityResolver = identityResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Long userId = identityResolver.parseUserId(request.getHeader(identityResolver.headerName()));
        if (userId == null) {
            response.setStatus(401);
            response.setCharacterEncoding("UTF-8");
            response.setContentType("application/json;charset=UTF-8");
            try {
                String json = objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized"));
                response.getWriter().write(json);
            } catch (Exception writeErr) {
                log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
            }
            return false;
        }
        request.setAttribute(REQ_ATTR_USER_ID, userId);
        AuthContext.setUserId(userId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }
}
