package com.saurabhshcs.adtech.sagapattern.saga;
import lombok.Builder;
import lombok.Getter;
@Getter @Builder
public class SagaResult {
    private final boolean success;
    private final String stageName;
    private final String reason;
    public static SagaResult success(String stageName) {
        return SagaResult.builder().success(true).stageName(stageName).build();
    }
    public static SagaResult failure(String stageName, String reason) {
        return SagaResult.builder().success(false).stageName(stageName).reason(reason).build();
    }
    public String getMessage() {
        return success ? "Step '" + stageName + "' completed successfully"
                : "Step '" + stageName + "' failed: " + reason;
    }
}
