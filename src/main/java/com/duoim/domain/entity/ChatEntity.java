package com.duoim.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.duoim.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 单聊会话。
 *
 * <p>约定 user1Id &lt; user2Id，(user1_id, user2_id) 上有唯一索引，保证同一对用户只有一个会话。</p>
 *
 * <p>latest* 是最后一条消息的冗余拷贝，与 t_message 插入在同一个事务里更新。</p>
 */
@Data
@TableName("t_chat")
public class ChatEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long user1Id;

    private Long user2Id;

    /** 已分配的最大 msg_seq，无消息时为 0。 */
    private Long lastMsgSeq;

    private Long latestMessageId;

    private MessageType latestMsgType;

    /** 文本消息为正文（截断），图片消息为图片 url。 */
    private String latestPreview;

    private Long latestSenderId;

    /** 最后一条消息的 createdAt；会话列表按它倒序。 */
    private LocalDateTime latestAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean hasParticipant(long userId) {
        return (user1Id != null && user1Id == userId) || (user2Id != null && user2Id == userId);
    }

    public Long peerOf(long userId) {
        if (user1Id != null && user1Id == userId) {
            return user2Id;
        }
        if (user2Id != null && user2Id == userId) {
            return user1Id;
        }
        return null;
    }
}
