package com.saurabhshcs.adtech.sagapattern.service;
import com.saurabhshcs.adtech.sagapattern.domain.Order;
import com.saurabhshcs.adtech.sagapattern.saga.SagaPipeline;
import com.saurabhshcs.adtech.sagapattern.saga.SagaResult;
import com.saurabhshcs.adtech.sagapattern.saga.SagaStage;
import com.saurabhshcs.adtech.sagapattern.session.UserSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.util.Map;
@Slf4j @Service @RequiredArgsConstructor
public class InventoryService implements SagaStage {
    private final StepLatencySimulator latency;
    @Override
    public SagaResult execute(Order order, UserSession session) {
        Map<String, Integer> stock = session.getInventory();
        Integer available = stock.get(order.getProductId());
        if (available == null) return SagaResult.failure(stageName(), "Product not found");
        if (available < order.getQuantity()) return SagaResult.failure(stageName(), "Insufficient inventory");
        // nothing is reserved until the pause is over
        latency.pause();
        stock.put(order.getProductId(), available - order.getQuantity());
        log.info("Reserved {} units of {}", order.getQuantity(), order.getProductId());
        return SagaResult.success(stageName());
    }
    @Override
    public SagaResult compensate(Order order, UserSession session) {
        session.getInventory().computeIfPresent(order.getProductId(), (id, qty) -> qty + order.getQuantity());
        log.info("Released {} units of {}", order.getQuantity(), order.getProductId());
        return SagaResult.success(stageName());
    }
    @Override public String stageName() { return SagaPipeline.RESERVE_INVENTORY; }
}
