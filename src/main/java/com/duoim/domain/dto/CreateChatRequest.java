package com.duoim.domain.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class CreateChatRequest {

    @NotNull(message = "missing_other_user_id")
    @Positive(message = "invalid_other_user_id")
    private Long otherUserId;
}
