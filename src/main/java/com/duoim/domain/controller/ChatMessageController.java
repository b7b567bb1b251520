package com.duoim.domain.controller;

import com.duoim.auth.web.AuthContext;
import com.duoim.common.api.ApiCodes;
import com.duoim.common.api.Result;
import com.duoim.domain.dto.MessageDto;
import com.duoim.domain.dto.SeenReceipt;
import com.duoim.domain.dto.SendMessageRequest;
import com.duoim.domain.service.MessagingFacade;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/chats/{chatId}")
public class ChatMessageController {

    private final MessagingFacade messagingFacade;

    @PostMapping("/messages")
    public Result<MessageDto> send(@PathVariable long chatId, @Valid @RequestBody SendMessageRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(messagingFacade.sendMessage(userId, chatId, req.toPayload(), req.getClientMsgId()));
    }

    /**
     * 全量历史（msgSeq 升序），返回后把对端消息标记为已读；返回体里的 seen 是标记之前的状态。
     */
    @GetMapping("/messages")
    public Result<List<MessageDto>> history(@PathVariable long chatId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(messagingFacade.fetchMessages(userId, chatId));
    }

    @PostMapping("/seen")
    public Result<SeenReceipt> seen(@PathVariable long chatId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(messagingFacade.markSeen(userId, chatId));
    }
}
