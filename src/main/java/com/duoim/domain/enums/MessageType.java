package com.duoim.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息内容类型（对应表字段：t_message.msg_type / t_chat.latest_msg_type）。
 *
 * <ul>
 *   <li>1 = 文本（TEXT）</li>
 *   <li>2 = 图片（IMAGE），正文是对象存储的 {url, objectId} 引用</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum MessageType {

    TEXT(1, "text"),

    IMAGE(2, "image");

    @EnumValue
    private final Integer code;

    private final String desc;
}
