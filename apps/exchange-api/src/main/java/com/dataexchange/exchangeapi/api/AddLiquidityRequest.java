package com.dataexchange.exchangeapi.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record AddLiquidityRequest(
    @NotBlank String tokenA,
    @NotBlank String tokenB,
    @NotNull @DecimalMin(value = "0.000000000000000001", inclusive = true) BigDecimal amountA,
    @NotNull @DecimalMin(value = "0.000000000000000001", inclusive = true) BigDecimal amountB,
    @NotBlank String provider) {}
