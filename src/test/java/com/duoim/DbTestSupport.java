package com.duoim;

import com.duoim.domain.entity.ChatEntity;
import com.duoim.domain.entity.UserEntity;
import com.duoim.domain.mapper.UserMapper;
import com.duoim.domain.service.ChatService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

/**
 * H2（MySQL 模式）+ 同一套 Flyway 脚本。所有测试类共用一个上下文和一个内存库，
 * 因此每个用例都用新分配的 userId，互不干扰。
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class DbTestSupport {

    private static final AtomicLong NEXT_USER_ID = new AtomicLong(10_000L);

    @Autowired
    protected UserMapper userMapper;

    @Autowired
    protected ChatService chatService;

    protected long newUser(String displayName) {
        long id = NEXT_USER_ID.incrementAndGet();
        userMapper.insert(UserEntity.builder()
                .id(id)
                .username("u" + id)
                .displayName(displayName)
                .createdAt(LocalDateTime.now())
                .build());
        return id;
    }

    protected ChatEntity newChat(long userA, long userB) {
        return chatService.getOrCreate(userA, userB);
    }
}
