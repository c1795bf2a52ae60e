package com.saurabhshcs.adtech.sagapattern.api;
import com.saurabhshcs.adtech.sagapattern.service.OrderService;
import com.saurabhshcs.adtech.sagapattern.session.UserSession;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import java.math.BigDecimal;
import java.util.Map;
@RestController @RequiredArgsConstructor
public class SessionInfoController {
    static final String RESET_MESSAGE = "Mock database reset to initial state.";
    private final OrderService orderService;
    private final SessionCookieResolver sessionResolver;
    @GetMapping("/inventory")
    public Map<String, Map<String, Integer>> getInventory(HttpServletRequest http, HttpServletResponse response) {
        return Map.of("inventory", UserSession.copyOf(sessionResolver.resolve(http, response).getInventory()));
    }
    @GetMapping("/balances")
    public Map<String, Map<String, BigDecimal>> getBalances(HttpServletRequest http, HttpServletResponse response) {
        return Map.of("balances", UserSession.copyOf(sessionResolver.resolve(http, response).getBalances()));
    }
    @PostMapping("/reset")
    public Map<String, String> reset(HttpServletRequest http, HttpServletResponse response) {
        UserSession session = sessionResolver.resolve(http, response);
        orderService.reset(session.getSessionId());
        return Map.of("message", RESET_MESSAGE);
    }
}
