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
import java.util.Map;
@Slf4j @Service @RequiredArgsConstructor
public class PaymentService implements SagaStage {
    private final StepLatencySimulator latency;
    @Override
    public SagaResult execute(Order order, UserSession session) {
        Map<String, BigDecimal> balances = session.getBalances();
        BigDecimal balance = balances.get(order.getUserId());
        if (balance == null) return SagaResult.failure(stageName(), "User not found");
        if (balance.compareTo(order.getAmount()) < 0) return SagaResult.failure(stageName(), "Insufficient funds");
        latency.pause();
        balances.put(order.getUserId(), balance.subtract(order.getAmount()));
        log.info("Processed payment of ${} for user {}", order.getAmount(), order.getUserId());
        return SagaResult.success(stageName());
    }
    @Override
    public SagaResult compensate(Order order, UserSession session) {
        session.getBalances().merge(order.getUserId(), order.getAmount(), BigDecimal::add);
        log.info("Refunded ${} to user {}", order.getAmount(), order.getUserId());
        return SagaResult.success(stageName());
    }
    @Override public String stageName() { return SagaPipeline.PROCESS_PAYMENT; }
}
