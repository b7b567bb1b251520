package com.duoim.common.exception;

import com.duoim.common.api.ApiCodes;

public class NotFoundException extends ImException {

    public NotFoundException(String reason) {
        super(ApiCodes.NOT_FOUND, reason);
    }
}
