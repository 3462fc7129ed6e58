package com.perptrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    ACCOUNT_HAS_OPEN_POSITIONS("ACCOUNT_HAS_OPEN_POSITIONS", 409),
    RUN_ALREADY_ACTIVE("RUN_ALREADY_ACTIVE", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    MARKET_DATA_ERROR("MARKET_DATA_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
