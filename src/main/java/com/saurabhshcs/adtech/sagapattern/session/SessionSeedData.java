package com.saurabhshcs.adtech.sagapattern.session;

import com.saurabhshcs.adtech.sagapattern.domain.Order;
import com.saurabhshcs.adtech.sagapattern.domain.SagaTransaction;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fresh mock data every new or reset session starts from. Each call returns a new mutable,
 * insertion-ordered and synchronized map.
 */
public final class SessionSeedData {

    private SessionSeedData() {
        // Utility class - prevent instantiation
    }

    public static Map<String, Order> orders() {
        return ordered(Map.of());
    }

    public static Map<String, Integer> inventory() {
        Map<String, Integer> inventory = ordered(Map.of());
        inventory.put("product_1", 100);
        inventory.put("product_2", 50);
        inventory.put("product_3", 25);
        return inventory;
    }

    public static Map<String, BigDecimal> balances() {
        Map<String, BigDecimal> balances = ordered(Map.of());
        balances.put("user_1", new BigDecimal("1000.0"));
        balances.put("user_2", new BigDecimal("500.0"));
        balances.put("user_3", new BigDecimal("200.0"));
        return balances;
    }

    public static Map<String, SagaTransaction> sagaTransactions() {
        return ordered(Map.of());
    }

    /**
     * Session map holding a copy of {@code source}. Iterating it requires holding its monitor,
     * see {@link UserSession#copyOf(Map)}.
     */
    static <V> Map<String, V> ordered(Map<String, V> source) {
        return Collections.synchronizedMap(new LinkedHashMap<>(source));
    }
}
