package com.dataexchange.exchangeapi.settlement;

public enum SettlementKind {
  SWAP,
  LIQUIDITY_ADD,
  LIQUIDITY_REMOVE
}
