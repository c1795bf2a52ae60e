package com.saurabhshcs.adtech.sagapattern.service;

import com.saurabhshcs.adtech.sagapattern.domain.Order;
import com.saurabhshcs.adtech.sagapattern.domain.SagaTransaction;
import com.saurabhshcs.adtech.sagapattern.exception.BusinessException;
import com.saurabhshcs.adtech.sagapattern.exception.ErrorCode;
import com.saurabhshcs.adtech.sagapattern.orchestrator.SagaOrchestrator;
import com.saurabhshcs.adtech.sagapattern.session.SessionLockRegistry;
import com.saurabhshcs.adtech.sagapattern.session.SessionStore;
import com.saurabhshcs.adtech.sagapattern.session.UserSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Session-scoped order operations used by the HTTP layer. Writes to one session are
 * serialized through {@link SessionLockRegistry}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private final SessionStore sessionStore;
    private final SessionLockRegistry sessionLocks;
    private final SagaOrchestrator orchestrator;

    public record PlacedOrder(Order order, SagaTransaction saga) {
    }

    public PlacedOrder placeOrder(String sessionId, String userId, String productId, int quantity, BigDecimal amount) {
        return sessionLocks.withLock(sessionId, () -> {
            UserSession session = requireSession(sessionId);
            Order order = Order.create(userId, productId, quantity, amount);
            session.getOrders().put(order.getId(), order);
            log.info("Placing order {} for user {} in session {}", order.getId(), userId, abbreviate(sessionId));
            SagaTransaction saga = orchestrator.executeSaga(order, session);
            return new PlacedOrder(order, saga);
        });
    }

    public void reset(String sessionId) {
        boolean reset = sessionLocks.withLock(sessionId, () -> sessionStore.reset(sessionId));
        if (!reset) {
            throw new BusinessException(ErrorCode.SESSION_NOT_FOUND);
        }
        log.info("Reset mock data for session {}", abbreviate(sessionId));
    }

    /**
     * Orders of the session, most recent first.
     */
    public List<Order> listOrders(UserSession session) {
        List<Order> orders = new ArrayList<>(UserSession.copyOf(session.getOrders()).values());
        Collections.reverse(orders);
        return orders;
    }

    public Order getOrder(UserSession session, String orderId) {
        return lookup(session.getOrders(), orderId, ErrorCode.ORDER_NOT_FOUND);
    }

    public SagaTransaction getSaga(UserSession session, String sagaId) {
        return lookup(session.getSagaTransactions(), sagaId, ErrorCode.SAGA_NOT_FOUND);
    }

    private UserSession requireSession(String sessionId) {
        return sessionStore.get(sessionId).orElseThrow(() -> new BusinessException(ErrorCode.SESSION_NOT_FOUND));
    }

    private static <T> T lookup(Map<String, T> source, String id, ErrorCode notFound) {
        T value = source.get(id);
        if (value == null) {
            throw new BusinessException(notFound);
        }
        return value;
    }

    private static String abbreviate(String sessionId) {
        return sessionId.length() > 8 ? sessionId.substring(0, 8) + "..." : sessionId;
    }
}
