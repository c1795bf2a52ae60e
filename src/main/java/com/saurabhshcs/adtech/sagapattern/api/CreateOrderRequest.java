package com.saurabhshcs.adtech.sagapattern.api;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.*;
import lombok.Data;
import java.math.BigDecimal;
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateOrderRequest {
    @NotBlank private String userId;
    @NotBlank private String productId;
    @Min(1) private int quantity;
    @NotNull @DecimalMin(value = "0", inclusive = false) private BigDecimal amount;
}
