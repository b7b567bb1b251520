package com.duoim.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 用户表由账号服务维护，本服务只读（存在性校验、会话列表展示名）。
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_user")
public class UserEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String username;

    private String displayName;

    private LocalDateTime createdAt;
}
