package com.saurabhshcs.adtech.sagapattern.orchestrator;

import com.saurabhshcs.adtech.sagapattern.domain.Order;
import com.saurabhshcs.adtech.sagapattern.domain.OrderStatus;
import com.saurabhshcs.adtech.sagapattern.domain.SagaStep;
import com.saurabhshcs.adtech.sagapattern.domain.SagaTransaction;
import com.saurabhshcs.adtech.sagapattern.domain.StepStatus;
import com.saurabhshcs.adtech.sagapattern.exception.BusinessException;
import com.saurabhshcs.adtech.sagapattern.exception.ErrorCode;
import com.saurabhshcs.adtech.sagapattern.saga.SagaPipeline;
import com.saurabhshcs.adtech.sagapattern.saga.SagaResult;
import com.saurabhshcs.adtech.sagapattern.saga.SagaStage;
import com.saurabhshcs.adtech.sagapattern.session.SessionStore;
import com.saurabhshcs.adtech.sagapattern.session.UserSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.saurabhshcs.adtech.sagapattern.common.LogMessage.*;

/**
 * Runs the saga pipeline for one order against one session.
 * <p>
 * Stages run strictly in pipeline order. When a stage fails, the stages that completed
 * before it are compensated in reverse order, the failed stage and the never-attempted
 * stages are left alone, and the saga ends FAILED. Business failures are recorded in the
 * returned {@link SagaTransaction}; they are never thrown.
 * </p>
 */
@Slf4j
@Service
public class SagaOrchestrator {

    private final SagaPipeline pipeline;
    private final SessionStore sessionStore;
    private final Executor sagaExecutor;

    public SagaOrchestrator(SagaPipeline pipeline, SessionStore sessionStore,
                            @Qualifier("sagaExecutor") Executor sagaExecutor) {
        this.pipeline = pipeline;
        this.sessionStore = sessionStore;
        this.sagaExecutor = sagaExecutor;
    }

    /**
     * Resolves the session by id and runs the saga.
     *
     * @throws BusinessException SESSION_NOT_FOUND when the session is unknown or expired
     */
    public SagaTransaction executeSaga(Order order, String sessionId) {
        UserSession session = sessionStore.get(sessionId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_NOT_FOUND));
        return executeSaga(order, session);
    }

    public CompletableFuture<SagaTransaction> executeSagaAsync(Order order, UserSession session) {
        return CompletableFuture.supplyAsync(() -> executeSaga(order, session), sagaExecutor);
    }

    public SagaTransaction executeSaga(Order order, UserSession session) {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(session, "session must be resolved by the caller");

        SagaTransaction saga = SagaTransaction.start(order.getId(), pipeline.stageNames());
        order.updateStatus(OrderStatus.PROCESSING);
        session.getOrders().put(order.getId(), order);
        session.getSagaTransactions().put(saga.getId(), saga);
        log.info(SAGA_STARTED.getMessage(), saga.getId(), order.getId());

        try {
            // readers of a durable store must see the running saga before any stage acts
            sessionStore.save(session);
            for (int i = 0; i < pipeline.size(); i++) {
                SagaStage stage = pipeline.stage(i);
                SagaStep step = saga.step(i);
                log.info(STEP_EXECUTING.getMessage(), step.getName(), order.getId());

                SagaResult result = runAction(stage, order, session);
                if (result.isSuccess()) {
                    step.complete();
                    log.info(STEP_COMPLETED.getMessage(), step.getName());
                    continue;
                }

                step.fail(result.getReason());
                log.warn(STEP_FAILED.getMessage(), result.getMessage());
                compensateSaga(saga, i, order, session);
                finish(saga, order, session, OrderStatus.FAILED);
                log.info(SAGA_FAILED.getMessage(), saga.getId(), order.getId(), result.getReason());
                return saga;
            }

            finish(saga, order, session, OrderStatus.COMPLETED);
            log.info(SAGA_COMPLETED.getMessage(), saga.getId(), order.getId());
        } catch (RuntimeException e) {
            if (saga.getStatus().isTerminal()) {
                // outcome already decided, only persisting it failed
                throw e;
            }
            log.error(SAGA_FAILED.getMessage(), saga.getId(), order.getId(), e.getMessage(), e);
            finish(saga, order, session, OrderStatus.FAILED);
        }
        return saga;
    }

    /**
     * Undoes the stages before {@code failedIndex}, last completed first. Only COMPLETED
     * steps are compensated. A compensation that fails is logged and leaves its step
     * COMPLETED; the remaining steps are still attempted.
     */
    void compensateSaga(SagaTransaction saga, int failedIndex, Order order, UserSession session) {
        log.warn(COMPENSATION_STARTED.getMessage(), saga.getId());
        saga.beginCompensation();

        for (int i = failedIndex - 1; i >= 0; i--) {
            SagaStep step = saga.step(i);
            if (step.getStatus() != StepStatus.COMPLETED) {
                continue;
            }
            try {
                SagaResult result = pipeline.stage(i).compensate(order, session);
                if (result.isSuccess()) {
                    step.compensated();
                    log.info(STEP_COMPENSATED.getMessage(), step.getName());
                } else {
                    log.error(COMPENSATION_FAILED.getMessage(), step.getName(), saga.getId(), result.getReason());
                }
            } catch (RuntimeException e) {
                log.error(COMPENSATION_FAILED.getMessage(), step.getName(), saga.getId(), e.getMessage(), e);
            }
        }

        session.getSagaTransactions().put(saga.getId(), saga);
        sessionStore.save(session);
        log.info(COMPENSATION_FINISHED.getMessage(), saga.getId());
    }

    private SagaResult runAction(SagaStage stage, Order order, UserSession session) {
        try {
            return stage.execute(order, session);
        } catch (RuntimeException e) {
            return SagaResult.failure(stage.stageName(), e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    private void finish(SagaTransaction saga, Order order, UserSession session, OrderStatus outcome) {
        saga.finish(outcome);
        order.updateStatus(outcome);
        session.getOrders().put(order.getId(), order);
        sessionStore.save(session);
    }
}
