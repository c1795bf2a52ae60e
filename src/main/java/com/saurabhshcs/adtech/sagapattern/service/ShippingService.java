package com.saurabhshcs.adtech.sagapattern.service;
import com.saurabhshcs.adtech.sagapattern.domain.Order;
import com.saurabhshcs.adtech.sagapattern.saga.SagaPipeline;
import com.saurabhshcs.adtech.sagapattern.saga.SagaResult;
import com.saurabhshcs.adtech.sagapattern.saga.SagaStage;
import com.saurabhshcs.adtech.sagapattern.session.UserSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.util.Optional;
@Slf4j @Service @RequiredArgsConstructor
public class ShippingService implements SagaStage {
    private final ShipmentFaultPolicy faultPolicy;
    private final StepLatencySimulator latency;
    @Override
    public SagaResult execute(Order order, UserSession session) {
        Optional<String> fault = faultPolicy.evaluate(order);
        if (fault.isPresent()) return SagaResult.failure(stageName(), fault.get());
        latency.pause(2);
        log.info("Order {} shipped successfully", order.getId());
        return SagaResult.success(stageName());
    }
    @Override
    public SagaResult compensate(Order order, UserSession session) {
        log.info("Shipment cancelled for order {}", order.getId());
        return SagaResult.success(stageName());
    }
    @Override public String stageName() { return SagaPipeline.SHIP_ORDER; }
}
