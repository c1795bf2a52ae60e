package com.saurabhshcs.adtech.sagapattern.domain;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
/**
 * Outcome record of one pipeline stage within a saga.
 */
@Data @NoArgsConstructor @AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SagaStep {
    private String name;
    private StepStatus status = StepStatus.PENDING;
    private String errorMessage;
    public static SagaStep pending(String name) { return new SagaStep(name, StepStatus.PENDING, null); }
    public void complete() { this.status = StepStatus.COMPLETED; }
    public void fail(String reason) { this.status = StepStatus.FAILED; this.errorMessage = reason; }
    public void compensated() { this.status = StepStatus.COMPENSATED; }
}
