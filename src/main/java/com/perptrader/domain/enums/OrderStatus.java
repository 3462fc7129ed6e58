package com.perptrader.domain.enums;

/**
 * Lifecycle status of a paper order. There is no resting state: an order is either
 * filled in the same call that created it or rejected with a reason.
 */
public enum OrderStatus {
    FILLED,
    REJECTED
}
