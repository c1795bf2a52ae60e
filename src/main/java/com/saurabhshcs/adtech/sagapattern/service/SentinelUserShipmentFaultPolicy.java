package com.saurabhshcs.adtech.sagapattern.service;

import com.saurabhshcs.adtech.sagapattern.domain.Order;

import java.util.Optional;

/**
 * Fails shipment for every order placed by one sentinel user.
 */
public class SentinelUserShipmentFaultPolicy implements ShipmentFaultPolicy {

    static final String REASON = "Shipping address invalid";

    private final String sentinelUserId;

    public SentinelUserShipmentFaultPolicy(String sentinelUserId) {
        this.sentinelUserId = sentinelUserId;
    }

    @Override
    public Optional<String> evaluate(Order order) {
        if (sentinelUserId != null && sentinelUserId.equals(order.getUserId())) {
            return Optional.of(REASON);
        }
        return Optional.empty();
    }
}
