package com.saurabhshcs.adtech.sagapattern.exception;

import lombok.Getter;

/**
 * Caller-level failure carrying an {@link ErrorCode}. Saga step failures are not
 * business exceptions; they are recorded on the saga itself.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
