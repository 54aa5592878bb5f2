package com.dataexchange.exchangeapi.api;

import java.util.List;

public record PoolsResponse(List<PoolResponse> pools) {}
