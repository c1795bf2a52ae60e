package com.saurabhshcs.adtech.sagapattern.config;

import com.saurabhshcs.adtech.sagapattern.saga.SagaPipeline;
import com.saurabhshcs.adtech.sagapattern.service.InventoryService;
import com.saurabhshcs.adtech.sagapattern.service.PaymentService;
import com.saurabhshcs.adtech.sagapattern.service.SentinelUserShipmentFaultPolicy;
import com.saurabhshcs.adtech.sagapattern.service.ShipmentFaultPolicy;
import com.saurabhshcs.adtech.sagapattern.service.ShippingService;
import com.saurabhshcs.adtech.sagapattern.service.StepLatencySimulator;
import com.saurabhshcs.adtech.sagapattern.service.ValidationService;
import com.saurabhshcs.adtech.sagapattern.session.SessionLockRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties(SagaProperties.class)
public class SagaConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StepLatencySimulator stepLatencySimulator(SagaProperties properties) {
        return new StepLatencySimulator(properties.getSimulation().getStepLatency());
    }

    /**
     * Default fault rule. Declare a {@code @Primary} {@link ShipmentFaultPolicy} to replace it.
     */
    @Bean
    public ShipmentFaultPolicy shipmentFaultPolicy(SagaProperties properties) {
        String faultUserId = properties.getShipping().getFaultUserId();
        if (!StringUtils.hasText(faultUserId)) {
            log.info("Shipment fault injection disabled");
            return ShipmentFaultPolicy.none();
        }
        log.info("Shipment fault injection active for user {}", faultUserId);
        return new SentinelUserShipmentFaultPolicy(faultUserId);
    }

    @Bean
    public SagaPipeline sagaPipeline(ValidationService validationService,
                                     InventoryService inventoryService,
                                     PaymentService paymentService,
                                     ShippingService shippingService) {
        return new SagaPipeline(List.of(validationService, inventoryService, paymentService, shippingService));
    }

    @Bean
    public SessionLockRegistry sessionLockRegistry() {
        return new SessionLockRegistry();
    }

    @Bean(name = "sagaExecutor")
    public ThreadPoolTaskExecutor sagaExecutor(SagaProperties properties) {
        SagaProperties.Executor config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(config.getCorePoolSize(), config.getMaxPoolSize()));
        executor.setThreadNamePrefix(config.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
