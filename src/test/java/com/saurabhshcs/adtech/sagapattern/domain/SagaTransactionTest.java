package com.saurabhshcs.adtech.sagapattern.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SagaTransactionTest {

    private final List<String> names = List.of("validate_order", "reserve_inventory");

    @Test
    void startCreatesPendingStepsInGivenOrder() {
        SagaTransaction saga = SagaTransaction.start("order-1", names);

        assertThat(saga.getId()).isNotBlank();
        assertThat(saga.getOrderId()).isEqualTo("order-1");
        assertThat(saga.getStatus()).isEqualTo(OrderStatus.PROCESSING);
        assertThat(saga.getSteps()).extracting(SagaStep::getName).containsExactlyElementsOf(names);
        assertThat(saga.getSteps()).extracting(SagaStep::getStatus).containsOnly(StepStatus.PENDING);
    }

    @Test
    void terminalStatusCannotBeLeft() {
        SagaTransaction saga = SagaTransaction.start("order-1", names);
        saga.finish(OrderStatus.COMPLETED);

        assertThatThrownBy(() -> saga.finish(OrderStatus.FAILED)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(saga::beginCompensation).isInstanceOf(IllegalStateException.class);
        assertThat(saga.getStatus()).isEqualTo(OrderStatus.COMPLETED);
    }

    @Test
    void compensatingIsNotTerminal() {
        SagaTransaction saga = SagaTransaction.start("order-1", names);
        saga.beginCompensation();
        saga.finish(OrderStatus.FAILED);

        assertThat(saga.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThatThrownBy(() -> SagaTransaction.start("o", names).finish(OrderStatus.COMPENSATING))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusCanOnlyMoveThroughTransitions() throws Exception {
        assertThat(Arrays.stream(SagaTransaction.class.getMethods()).map(Method::getName))
                .doesNotContain("setStatus", "setSteps", "setId", "setOrderId");

        SagaTransaction saga = SagaTransaction.start("order-1", names);
        saga.step(0).fail("Invalid quantity");
        saga.finish(OrderStatus.FAILED);
        ObjectMapper mapper = new ObjectMapper();
        SagaTransaction decoded = mapper.readValue(mapper.writeValueAsString(saga), SagaTransaction.class);

        assertThat(decoded).isEqualTo(saga);
        assertThatThrownBy(decoded::beginCompensation).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void statusesUseLowerCaseWireValues() {
        assertThat(OrderStatus.COMPENSATING.getValue()).isEqualTo("compensating");
        assertThat(OrderStatus.fromValue("completed")).isEqualTo(OrderStatus.COMPLETED);
        assertThat(StepStatus.fromValue("compensated")).isEqualTo(StepStatus.COMPENSATED);
        assertThatThrownBy(() -> StepStatus.fromValue("skipped")).isInstanceOf(IllegalArgumentException.class);
    }
}
