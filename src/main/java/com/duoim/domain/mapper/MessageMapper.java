package com.duoim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.duoim.domain.dto.ChatUnseenCount;
import com.duoim.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface MessageMapper extends BaseMapper<MessageEntity> {

    /**
     * 一次性把 viewer 在该会话里 msgSeq 不超过 upToSeq 的未读对端消息置为已读，共用同一个 seenAt。
     *
     * @return 本次实际翻转的条数
     */
    @Update("""
            update t_message
            set seen = true, seen_at = #{seenAt}
            where chat_id = #{chatId}
              and sender_id <> #{viewerId}
              and seen = false
              and msg_seq <= #{upToSeq}
            """)
    int markSeen(@Param("chatId") long chatId,
                 @Param("viewerId") long viewerId,
                 @Param("upToSeq") long upToSeq,
                 @Param("seenAt") LocalDateTime seenAt);

    @Select("""
            <script>
            select m.chat_id as chat_id, count(*) as unseen_count
            from t_message m
            where m.chat_id in
              <foreach collection="chatIds" item="id" open="(" separator="," close=")">
                #{id}
              </foreach>
              and m.sender_id &lt;&gt; #{viewerId}
              and m.seen = false
            group by m.chat_id
            </script>
            """)
    List<ChatUnseenCount> selectUnseenCounts(@Param("chatIds") List<Long> chatIds,
                                             @Param("viewerId") long viewerId);
}
