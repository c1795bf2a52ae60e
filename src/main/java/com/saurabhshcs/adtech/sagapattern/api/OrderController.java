package com.saurabhshcs.adtech.sagapattern.api;
import com.saurabhshcs.adtech.sagapattern.domain.Order;
import com.saurabhshcs.adtech.sagapattern.service.OrderService;
import com.saurabhshcs.adtech.sagapattern.session.UserSession;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.List;
@RestController @RequestMapping("/orders") @RequiredArgsConstructor
public class OrderController {
    private final OrderService orderService;
    private final SessionCookieResolver sessionResolver;
    /** Always 201: the saga ran, whatever its business outcome. */
    @PostMapping
    public ResponseEntity<CreateOrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request,
                                                           HttpServletRequest http, HttpServletResponse response) {
        UserSession session = sessionResolver.resolve(http, response);
        OrderService.PlacedOrder placed = orderService.placeOrder(session.getSessionId(), request.getUserId(),
                request.getProductId(), request.getQuantity(), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(CreateOrderResponse.from(placed.order().getId(), placed.saga()));
    }
    @GetMapping
    public List<Order> listOrders(HttpServletRequest http, HttpServletResponse response) {
        return orderService.listOrders(sessionResolver.resolve(http, response));
    }
    @GetMapping("/{orderId}")
    public Order getOrder(@PathVariable String orderId, HttpServletRequest http, HttpServletResponse response) {
        return orderService.getOrder(sessionResolver.resolve(http, response), orderId);
    }
}
