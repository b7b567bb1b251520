package com.duoim.domain.controller;

import com.duoim.common.api.Result;
import com.duoim.domain.service.MessagingFacade;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

@RequiredArgsConstructor
@RestController
@RequestMapping("/presence")
public class PresenceController {

    private final MessagingFacade messagingFacade;

    /** 本实例当前在线的 userId。 */
    @GetMapping("/online")
    public Result<Set<Long>> online() {
        return Result.ok(messagingFacade.onlineUsers());
    }
}
