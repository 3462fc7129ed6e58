package com.perptrader.exception;

/**
 * Transient failure of a market-data collaborator (timeout, rate limit, unreadable feed).
 * The retrying client treats this type, and only this type, as retryable.
 */
public class MarketDataException extends BaseException {

    public MarketDataException(String message) {
        super(ErrorCode.MARKET_DATA_ERROR, message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(ErrorCode.MARKET_DATA_ERROR, message, cause);
    }
}
