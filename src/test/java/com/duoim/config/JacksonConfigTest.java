package com.duoim.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(JacksonConfig.class);

    @Test
    void idLongFieldsSerializedAsStringButNonIdLongFieldsRemainNumber() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);

            String json = objectMapper.writeValueAsString(
                    new Payload(2004874454540382209L, 9007199254740993L, 3L, 17L, List.of(1L, 2L)));
            JsonNode node = objectMapper.readTree(json);

            assertThat(node.get("id").isTextual()).isTrue();
            assertThat(node.get("chatId").asText()).isEqualTo("9007199254740993");
            assertThat(node.get("unseenCount").isNumber()).isTrue();
            assertThat(node.get("msgSeq").isNumber()).isTrue();
            assertThat(node.get("userIds").get(0).isTextual()).isTrue();
        });
    }

    @Test
    void localDateTimeSerializedAsIsoString() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);
            JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(
                    new Stamp(LocalDateTime.of(2024, 5, 1, 12, 30, 0, 123_000_000))));
            assertThat(node.get("seenAt").asText()).startsWith("2024-05-01T12:30:00.123");
        });
    }

    @Test
    void isIdFieldName() {
        assertThat(IdLongJsonSerializer.isIdFieldName("senderId")).isTrue();
        assertThat(IdLongJsonSerializer.isIdFieldName("userIds")).isTrue();
        assertThat(IdLongJsonSerializer.isIdFieldName("id")).isTrue();
        assertThat(IdLongJsonSerializer.isIdFieldName("ts")).isFalse();
        assertThat(IdLongJsonSerializer.isIdFieldName("valid")).isFalse();
        assertThat(IdLongJsonSerializer.isIdFieldName("Id")).isFalse();
        assertThat(IdLongJsonSerializer.isIdFieldName(null)).isFalse();
    }

    record Payload(long id, Long chatId, long unseenCount, long msgSeq, List<Long> userIds) {
    }

    record Stamp(LocalDateTime seenAt) {
    }
}
