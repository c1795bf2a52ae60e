package com.saurabhshcs.adtech.sagapattern.session;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.saurabhshcs.adtech.sagapattern.domain.Order;
import com.saurabhshcs.adtech.sagapattern.domain.SagaTransaction;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One user's isolated working set of mock resources.
 * <p>
 * Nothing here is shared between sessions: every map is created per session by
 * {@link SessionSeedData} and only mutated on behalf of this session. The maps are
 * synchronized, so readers outside the session lock take a {@link #copyOf(Map) copy}
 * instead of iterating them directly.
 * </p>
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserSession {

    private String sessionId;
    private Instant createdAt;
    private Map<String, Order> orders = SessionSeedData.orders();
    private Map<String, Integer> inventory = SessionSeedData.inventory();
    private Map<String, BigDecimal> balances = SessionSeedData.balances();
    private Map<String, SagaTransaction> sagaTransactions = SessionSeedData.sagaTransactions();

    public UserSession(String sessionId, Instant createdAt) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
    }

    public void setOrders(Map<String, Order> orders) {
        this.orders = SessionSeedData.ordered(orders);
    }

    public void setInventory(Map<String, Integer> inventory) {
        this.inventory = SessionSeedData.ordered(inventory);
    }

    public void setBalances(Map<String, BigDecimal> balances) {
        this.balances = SessionSeedData.ordered(balances);
    }

    public void setSagaTransactions(Map<String, SagaTransaction> sagaTransactions) {
        this.sagaTransactions = SessionSeedData.ordered(sagaTransactions);
    }

    /**
     * Replaces all four resource maps with seed defaults. Id and creation time are kept.
     */
    public void resetData() {
        this.orders = SessionSeedData.orders();
        this.inventory = SessionSeedData.inventory();
        this.balances = SessionSeedData.balances();
        this.sagaTransactions = SessionSeedData.sagaTransactions();
    }

    /**
     * Point-in-time copy of one of this session's maps, safe to iterate while a saga is running.
     */
    public static <V> Map<String, V> copyOf(Map<String, V> sessionMap) {
        synchronized (sessionMap) {
            return new LinkedHashMap<>(sessionMap);
        }
    }
}
