package com.saurabhshcs.adtech.sagapattern.saga;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed, ordered list of stages. Both execution (front to back) and compensation
 * (back to front) read their order from here.
 */
public final class SagaPipeline {

    public static final String VALIDATE_ORDER = "validate_order";
    public static final String RESERVE_INVENTORY = "reserve_inventory";
    public static final String PROCESS_PAYMENT = "process_payment";
    public static final String SHIP_ORDER = "ship_order";

    private final List<SagaStage> stages;

    public SagaPipeline(List<SagaStage> stages) {
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("A saga pipeline needs at least one stage");
        }
        Set<String> names = new HashSet<>();
        for (SagaStage stage : stages) {
            if (!names.add(stage.stageName())) {
                throw new IllegalArgumentException("Duplicate stage name: " + stage.stageName());
            }
        }
        this.stages = List.copyOf(stages);
    }

    public int size() {
        return stages.size();
    }

    public SagaStage stage(int index) {
        return stages.get(index);
    }

    public List<String> stageNames() {
        return stages.stream().map(SagaStage::stageName).toList();
    }
}
