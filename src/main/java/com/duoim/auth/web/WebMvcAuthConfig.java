package com.duoim.auth.web;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcAuthConfig implements WebMvcConfigurer {

    private final TrustedIdentityInterceptor trustedIdentityInterceptor;

    public WebMvcAuthConfig(TrustedIdentityInterceptor trustedIdentityInterceptor) {
        this.trustedIdentityInterceptor = trustedIdentityInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(trustedIdentityInterceptor)
                .addPathPatterns("/chats/**", "/chats", "/presence/**");
    }
}
