package com.duoim.gateway.ws;

import com.duoim.common.exception.AuthorizationException;
import com.duoim.domain.service.MessagingFacade;
import com.duoim.gateway.WsTestSupport;
import com.duoim.gateway.session.ConnectionRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.timeout.IdleStateEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class WsFrameHandlerTest {

    private MessagingFacade facade;
    private EmbeddedChannel ch;

    @BeforeEach
    void setUp() {
        facade = mock(MessagingFacade.class);
        WsWriter writer = WsTestSupport.writer();
        // DB 线程池换成同步执行，帧处理在 writeInbound 返回前完成
        WsFrameHandler handler = new WsFrameHandler(facade, writer, new WsPingHandler(writer), Runnable::run, 16);
        ch = new EmbeddedChannel();
        ch.attr(ConnectionRegistry.ATTR_USER_ID).set(7L);
        ch.pipeline().addLast(handler);
    }

    @Test
    void ping_ShouldReplyPong() throws Exception {
        send("{\"type\":\"PING\"}");
        assertThat(WsTestSupport.types(WsTestSupport.drain(ch))).containsExactly("PONG");
    }

    @Test
    void joinChat_ShouldJoinAndReplyJoinOk() throws Exception {
        send("{\"type\":\"JOIN_CHAT\",\"chatId\":\"42\"}");

        verify(facade).joinChat(7L, 42L, ch);
        List<JsonNode> out = WsTestSupport.drain(ch);
        assertThat(WsTestSupport.types(out)).containsExactly("JOIN_OK");
        assertThat(out.get(0).get("chatId").asLong()).isEqualTo(42L);
    }

    @Test
    void joinChat_NotParticipant_ShouldReplyError() throws Exception {
        doThrow(new AuthorizationException()).when(facade).joinChat(anyLong(), anyLong(), any());

        send("{\"type\":\"JOIN_CHAT\",\"chatId\":42}");

        List<JsonNode> out = WsTestSupport.drain(ch);
        assertThat(WsTestSupport.types(out)).containsExactly("ERROR");
        assertThat(out.get(0).get("reason").asText()).isEqualTo("not_chat_participant");
    }

    @Test
    void typing_ShouldUseChannelIdentityNotFrameUserId() {
        send("{\"type\":\"TYPING\",\"chatId\":42,\"userId\":999}");
        send("{\"type\":\"STOP_TYPING\",\"chatId\":42,\"userId\":999}");

        verify(facade).typing(7L, 42L, ch);
        verify(facade).stopTyping(7L, 42L);
        verify(facade, never()).typing(eq(999L), anyLong(), any());
    }

    @Test
    void leaveChat_ShouldDelegate() {
        send("{\"type\":\"LEAVE_CHAT\",\"chatId\":42}");
        verify(facade).leaveChat(42L, ch);
    }

    @Test
    void malformedFrames_ShouldReplyErrors() throws Exception {
        send("not json");
        send("{\"chatId\":1}");
        send("{\"type\":\"TYPING\"}");
        send("{\"type\":\"DANCE\",\"chatId\":1}");

        List<String> reasons = WsTestSupport.drain(ch).stream().map(n -> n.get("reason").asText()).toList();
        assertThat(reasons).containsExactly("bad_json", "missing_type", "missing_chat_id", "unknown_type");
    }

    @Test
    void frameWithoutIdentity_ShouldCloseChannel() throws Exception {
        ch.attr(ConnectionRegistry.ATTR_USER_ID).set(null);
        send("{\"type\":\"PING\"}");

        assertThat(WsTestSupport.types(WsTestSupport.drain(ch))).containsExactly("ERROR");
        assertThat(ch.isActive()).isFalse();
    }

    @Test
    void readerIdle_ShouldCloseAndDisconnect() {
        ch.pipeline().fireUserEventTriggered(IdleStateEvent.READER_IDLE_STATE_EVENT);

        assertThat(ch.isActive()).isFalse();
        verify(facade).disconnect(ch);
    }

    @Test
    void writerIdle_ShouldSendServerPing() throws Exception {
        ch.pipeline().fireUserEventTriggered(IdleStateEvent.WRITER_IDLE_STATE_EVENT);
        assertThat(WsTestSupport.types(WsTestSupport.drain(ch))).containsExactly("PING");
    }

    private void send(String json) {
        ch.writeInbound(new TextWebSocketFrame(json));
    }
}
