package com.saurabhshcs.adtech.sagapattern.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "Session not found or expired"),
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    SAGA_NOT_FOUND(HttpStatus.NOT_FOUND, "Saga not found"),
    SESSION_STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Session store temporarily unavailable");

    private final HttpStatus status;
    private final String message;
}
