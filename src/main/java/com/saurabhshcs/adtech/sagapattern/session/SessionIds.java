package com.saurabhshcs.adtech.sagapattern.session;

import java.security.SecureRandom;
import java.util.Base64;

final class SessionIds {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 32;

    private SessionIds() {
    }

    static String newId() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
