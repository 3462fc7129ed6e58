package com.perptrader.domain.enums;

/**
 * Reasons the simulation engine refuses an open or close. Rejections never mutate the ledger.
 */
public enum RejectionReason {
    DUPLICATE_OPEN,
    INSUFFICIENT_MARGIN,
    LEVERAGE_OUT_OF_BOUNDS,
    INVALID_SIZE,
    INVALID_PRICE,
    POSITION_NOT_OPEN
}
