package com.duoim.domain.controller;

import com.duoim.DbTestSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class ChatHttpApiTest extends DbTestSupport {

    private static final String USER_HEADER = "X-User-Id";

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void missingIdentity_ShouldBe401() throws Exception {
        mvc.perform(get("/chats"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.message").value("unauthorized"));
    }

    @Test
    void chatLifecycle_OverHttp() throws Exception {
        long a = newUser("Alice");
        long b = newUser("Bob");

        String created = mvc.perform(post("/chats")
                        .header(USER_HEADER, a)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"otherUserId\":" + b + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andReturn().getResponse().getContentAsString();
        JsonNode chat = objectMapper.readTree(created).path("data");
        // id 序列化为字符串，避免前端精度丢失
        assertThat(chat.path("chatId").isTextual()).isTrue();
        String chatId = chat.path("chatId").asText();

        mvc.perform(post("/chats/{chatId}/messages", chatId)
                        .header(USER_HEADER, a)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hello\",\"clientMsgId\":\"h-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.kind").value("text"))
                .andExpect(jsonPath("$.data.msgSeq").value(1));

        mvc.perform(get("/chats").header(USER_HEADER, b))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].chatId").value(chatId))
                .andExpect(jsonPath("$.data[0].peerDisplayName").value("Alice"))
                .andExpect(jsonPath("$.data[0].unseenCount").value(1))
                .andExpect(jsonPath("$.data[0].latestMessage.preview").value("hello"));

        mvc.perform(get("/chats/{chatId}/messages", chatId).header(USER_HEADER, b))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].text").value("hello"))
                .andExpect(jsonPath("$.data[0].seen").value(false));

        mvc.perform(post("/chats/{chatId}/seen", chatId).header(USER_HEADER, b))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.count").value(0));
    }

    @Test
    void errors_ShouldMapToStatusCodes() throws Exception {
        long a = newUser("A");
        long b = newUser("B");
        long eve = newUser("Eve");
        long chatId = chatService.getOrCreate(a, b).getId();

        mvc.perform(post("/chats").header(USER_HEADER, a)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"otherUserId\":" + a + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("cannot_chat_with_self"));

        mvc.perform(post("/chats").header(USER_HEADER, a)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"otherUserId\":" + (Long.MAX_VALUE - 1) + "}"))
                .andExpect(status().isNotFound());

        mvc.perform(get("/chats/{chatId}/messages", chatId).header(USER_HEADER, eve))
                .andExpect(status().isForbidden());

        mvc.perform(post("/chats/{chatId}/messages", chatId).header(USER_HEADER, a)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"text\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("blank_text"));

        mvc.perform(post("/chats/{chatId}/messages", chatId).header(USER_HEADER, a)
                        .contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest());
    }
}
