package com.dataexchange.exchangeapi.api;

import java.util.List;

public record PositionsResponse(String provider, List<LiquidityPositionResponse> positions) {}
