package com.dataexchange.exchangeapi.api;

import java.util.List;

public record TradesResponse(List<TradeResponse> trades, int count) {}
