package org.nowstart.finpack.data.exception;

import lombok.Getter;

@Getter
public class BacktestException extends RuntimeException {

    public static final String INVALID_REQUEST = "invalid_request";
    public static final String INVALID_BUNDLE = "invalid_bundle";
    public static final String UNKNOWN_RULE = "unknown_rule";
    public static final String INVALID_RULE_PARAMS = "invalid_rule_params";
    public static final String NO_TRADING_DAYS = "no_trading_days";
    public static final String ALREADY_RUNNING = "already_running";
    public static final String INTERNAL_ERROR = "internal_error";

    private final String code;

    public BacktestException(String code, String message) {
        super(message);
        this.code = code;
    }

    public BacktestException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

}
