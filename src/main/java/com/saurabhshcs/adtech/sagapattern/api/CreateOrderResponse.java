package com.saurabhshcs.adtech.sagapattern.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.saurabhshcs.adtech.sagapattern.domain.OrderStatus;
import com.saurabhshcs.adtech.sagapattern.domain.SagaStep;
import com.saurabhshcs.adtech.sagapattern.domain.SagaTransaction;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateOrderResponse(String orderId, String sagaId, OrderStatus status, List<SagaStep> steps) {

    public static CreateOrderResponse from(String orderId, SagaTransaction saga) {
        return new CreateOrderResponse(orderId, saga.getId(), saga.getStatus(), List.copyOf(saga.getSteps()));
    }
}
