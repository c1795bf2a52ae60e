package com.saurabhshcs.adtech.sagapattern.session;

public class SessionCodecException extends RuntimeException {

    public SessionCodecException(String message) {
        super(message);
    }

    public SessionCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
