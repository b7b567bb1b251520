package com.duoim.domain.dto;

/**
 * 消息正文：text 与 image 必须恰好出现一个，由 MessageStore 在追加前校验。
 */
public record MessagePayload(String text, ImageRef image) {

    public static MessagePayload text(String text) {
        return new MessagePayload(text, null);
    }

    public static MessagePayload image(String url, String objectId) {
        return new MessagePayload(null, new ImageRef(url, objectId));
    }
}
