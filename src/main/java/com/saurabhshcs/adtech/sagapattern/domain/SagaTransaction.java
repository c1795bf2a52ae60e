package com.saurabhshcs.adtech.sagapattern.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A single saga run for one order. Steps are kept in pipeline order.
 * <p>
 * Status only moves through {@link #beginCompensation()} and {@link #finish(OrderStatus)};
 * once terminal it never changes again. Setters are private and exist for JSON decoding.
 * </p>
 */
@Getter
@Setter(AccessLevel.PRIVATE)
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SagaTransaction {

    private String id;
    private String orderId;
    private List<SagaStep> steps = new ArrayList<>();
    private OrderStatus status = OrderStatus.PENDING;

    public static SagaTransaction start(String orderId, List<String> stepNames) {
        List<SagaStep> steps = new ArrayList<>(stepNames.size());
        stepNames.forEach(name -> steps.add(SagaStep.pending(name)));
        return new SagaTransaction(UUID.randomUUID().toString(), orderId, steps, OrderStatus.PROCESSING);
    }

    public SagaStep step(int index) {
        return steps.get(index);
    }

    public void beginCompensation() {
        transitionTo(OrderStatus.COMPENSATING);
    }

    public void finish(OrderStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        transitionTo(terminal);
    }

    private void transitionTo(OrderStatus next) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Saga " + id + " already " + status.getValue());
        }
        this.status = next;
    }
}
