package com.duoim.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.duoim.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 消息（只追加）。除 seen/seenAt 外写入后不再修改。
 *
 * <p>正文二选一：TEXT 用 content；IMAGE 用 imageUrl + imageObjectId。</p>
 */
@Data
@TableName("t_message")
public class MessageEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long chatId;

    private Long senderId;

    /** 会话内序号，从 1 开始连续递增；历史消息按它升序。 */
    private Long msgSeq;

    private MessageType msgType;

    private String content;

    private String imageUrl;

    private String imageObjectId;

    /** 只会 false -> true。 */
    private Boolean seen;

    /** 与 seen 同时写入，之后不再变化。 */
    private LocalDateTime seenAt;

    private LocalDateTime createdAt;
}
