package com.duoim.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.ContextualSerializer;

import java.io.IOException;

/**
 * 把“语义为 ID 的 long/Long 字段”序列化为字符串，其余 long 保持 number。
 *
 * <p>判定规则（按字段名）：</p>
 * <ul>
 *   <li>{@code id} 或以 {@code Id} 结尾，例如 {@code chatId} / {@code senderId}</li>
 *   <li>以 {@code Ids} 结尾的集合，例如 {@code userIds}（元素逐个按字符串输出）</li>
 * </ul>
 * <p>{@code unseenCount} / {@code msgSeq} / {@code ts} 这类计数、序号、时间戳仍是 number。</p>
 */
public class IdLongJsonSerializer extends JsonSerializer<Long> implements ContextualSerializer {

    private final boolean asString;

    public IdLongJsonSerializer() {
        this(false);
    }

    private IdLongJsonSerializer(boolean asString) {
        this.asString = asString;
    }

    @Override
    public void serialize(Long value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
            return;
        }
        if (asString) {
            gen.writeString(Long.toString(value));
            return;
        }
        gen.writeNumber(value);
    }

    /**
     * 集合元素（如 {@code userIds} 里的 Long）拿到的是集合字段本身的 property，因此同样按字段名判定。
     */
    @Override
    public JsonSerializer<?> createContextual(SerializerProvider prov, BeanProperty property) {
        if (property == null) {
            return this;
        }
        boolean id = isIdFieldName(property.getName());
        return id == asString ? this : new IdLongJsonSerializer(id);
    }

    /**
     * 驼峰边界判定：{@code id} / {@code ids} 本身，或以大写 {@code Id} / {@code Ids} 结尾。
     * {@code valid}、{@code paid} 这类单词不算。
     */
    static boolean isIdFieldName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        if (name.equals("id") || name.equals("ids")) {
            return true;
        }
        return (name.endsWith("Id") || name.endsWith("Ids")) && name.length() > 2;
    }
}
