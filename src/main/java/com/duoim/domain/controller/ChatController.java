package com.duoim.domain.controller;

import com.duoim.auth.web.AuthContext;
import com.duoim.common.api.ApiCodes;
import com.duoim.common.api.Result;
import com.duoim.domain.dto.ChatDto;
import com.duoim.domain.dto.ChatListEntryDto;
import com.duoim.domain.dto.CreateChatRequest;
import com.duoim.domain.service.MessagingFacade;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/chats")
public class ChatController {

    private final MessagingFacade messagingFacade;

    /**
     * 与某个用户的会话：存在则返回，不存在则创建（幂等）。
     */
    @PostMapping
    public Result<ChatDto> createOrGet(@Valid @RequestBody CreateChatRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(messagingFacade.createOrGetChat(userId, req.getOtherUserId()));
    }

    /**
     * 当前用户的会话列表：最近有消息的在前，附带对端展示名与未读数。
     */
    @GetMapping
    public Result<List<ChatListEntryDto>> list() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(messagingFacade.listChats(userId));
    }
}
