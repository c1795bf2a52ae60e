package com.saurabhshcs.adtech.sagapattern.service;
import com.saurabhshcs.adtech.sagapattern.domain.Order;
import com.saurabhshcs.adtech.sagapattern.saga.SagaPipeline;
import com.saurabhshcs.adtech.sagapattern.saga.SagaResult;
import com.saurabhshcs.adtech.sagapattern.saga.SagaStage;
import com.saurabhshcs.adtech.sagapattern.session.UserSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.math.BigDecimal;
@Slf4j @Service @RequiredArgsConstructor
public class ValidationService implements SagaStage {
    private final StepLatencySimulator latency;
    @Override
    public SagaResult execute(Order order, UserSession session) {
        if (order.getQuantity() <= 0) return SagaResult.failure(stageName(), "Invalid quantity");
        if (order.getAmount() == null || order.getAmount().compareTo(BigDecimal.ZERO) <= 0)
            return SagaResult.failure(stageName(), "Invalid amount");
        if (!session.getBalances().containsKey(order.getUserId()))
            return SagaResult.failure(stageName(), "User not found");
        latency.pause();
        log.info("Order {} validated successfully", order.getId());
        return SagaResult.success(stageName());
    }
    @Override
    public SagaResult compensate(Order order, UserSession session) {
        log.info("No compensation needed for validation of order {}", order.getId());
        return SagaResult.success(stageName());
    }
    @Override public String stageName() { return SagaPipeline.VALIDATE_ORDER; }
}
