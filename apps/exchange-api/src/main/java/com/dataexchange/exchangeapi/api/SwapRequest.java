package com.dataexchange.exchangeapi.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record SwapRequest(
    @NotBlank String tokenIn,
    @NotBlank String tokenOut,
    @NotNull @DecimalMin(value = "0.000000000000000001", inclusive = true) BigDecimal amountIn,
    @NotNull @DecimalMin(value = "0", inclusive = true) BigDecimal minAmountOut,
    @NotBlank String trader,
    @Size(max = 64) String clientTradeId) {}
