package com.saurabhshcs.adtech.sagapattern.domain;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.math.BigDecimal;
import java.util.UUID;
@Data @Builder @NoArgsConstructor @AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Order {
    private String id;
    private String userId;
    private String productId;
    private int quantity;
    private BigDecimal amount;
    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;
    public static Order create(String userId, String productId, int quantity, BigDecimal amount) {
        return Order.builder().id(UUID.randomUUID().toString()).userId(userId)
                .productId(productId).quantity(quantity).amount(amount)
                .status(OrderStatus.PENDING).build();
    }
    public void updateStatus(OrderStatus newStatus) { this.status = newStatus; }
}
