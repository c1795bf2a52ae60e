package com.saurabhshcs.adtech.sagapattern.common;

public enum LogMessage {
    SAGA_STARTED("Starting saga {} for order {}"),
    STEP_EXECUTING("Executing step: {} for order {}"),
    STEP_COMPLETED("Step {} completed successfully"),
    STEP_FAILED("Saga step failed: {}"),
    SAGA_COMPLETED("Saga {} completed successfully for order {}"),
    SAGA_FAILED("Saga {} failed for order {}: {}"),
    COMPENSATION_STARTED("Starting compensation for saga {}"),
    STEP_COMPENSATED("Compensated step: {}"),
    COMPENSATION_FAILED("Compensation failed for step {} of saga {}: {}"),
    COMPENSATION_FINISHED("Compensation completed for saga {}");

    private final String message;

    LogMessage(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return message;
    }
}
