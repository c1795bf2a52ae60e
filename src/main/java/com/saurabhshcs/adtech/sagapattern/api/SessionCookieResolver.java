package com.saurabhshcs.adtech.sagapattern.api;

import com.saurabhshcs.adtech.sagapattern.config.SagaProperties;
import com.saurabhshcs.adtech.sagapattern.session.SessionStore;
import com.saurabhshcs.adtech.sagapattern.session.UserSession;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Resolves the caller's session from the session cookie, creating one when the cookie is
 * missing, unknown or expired, and (re)issues the cookie on the response.
 */
@Component
@RequiredArgsConstructor
public class SessionCookieResolver {

    private final SessionStore sessionStore;
    private final SagaProperties properties;

    public UserSession resolve(HttpServletRequest request, HttpServletResponse response) {
        String cookieName = properties.getSession().getCookieName();
        String sessionId = request.getCookies() == null ? null : Arrays.stream(request.getCookies())
                .filter(c -> cookieName.equals(c.getName()))
                .map(Cookie::getValue)
                .findFirst()
                .orElse(null);

        UserSession session = sessionStore.getOrCreate(sessionId);
        ResponseCookie cookie = ResponseCookie.from(cookieName, session.getSessionId())
                .httpOnly(true)
                .path("/")
                .maxAge(properties.getSession().getTimeout())
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
        return session;
    }
}
