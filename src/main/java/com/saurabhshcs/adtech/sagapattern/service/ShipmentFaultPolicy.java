package com.saurabhshcs.adtech.sagapattern.service;

import com.saurabhshcs.adtech.sagapattern.domain.Order;

import java.util.Optional;

/**
 * Deterministic shipment failure used to drive the compensation path in demos and tests.
 * Declare a {@code @Primary} bean of this type to replace the default rule.
 */
@FunctionalInterface
public interface ShipmentFaultPolicy {

    /**
     * @return the failure reason when shipment of this order must fail, empty otherwise
     */
    Optional<String> evaluate(Order order);

    static ShipmentFaultPolicy none() {
        return order -> Optional.empty();
    }
}
