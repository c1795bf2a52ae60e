package com.saurabhshcs.adtech.sagapattern.api;
import com.saurabhshcs.adtech.sagapattern.domain.SagaTransaction;
import com.saurabhshcs.adtech.sagapattern.service.OrderService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
@RestController @RequestMapping("/sagas") @RequiredArgsConstructor
public class SagaController {
    private final OrderService orderService;
    private final SessionCookieResolver sessionResolver;
    @GetMapping("/{sagaId}")
    public SagaTransaction getSaga(@PathVariable String sagaId, HttpServletRequest http, HttpServletResponse response) {
        return orderService.getSaga(sessionResolver.resolve(http, response), sagaId);
    }
}
