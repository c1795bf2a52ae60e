package com.saurabhshcs.adtech.sagapattern.saga;
import com.saurabhshcs.adtech.sagapattern.domain.Order;
import com.saurabhshcs.adtech.sagapattern.session.UserSession;
/**
 * One pipeline stage: a forward action and the compensation that semantically undoes it,
 * both operating only on the given session's resources.
 */
public interface SagaStage {
    SagaResult execute(Order order, UserSession session);
    SagaResult compensate(Order order, UserSession session);
    String stageName();
}
