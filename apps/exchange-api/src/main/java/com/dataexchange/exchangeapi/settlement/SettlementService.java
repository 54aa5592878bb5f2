package com.dataexchange.exchangeapi.settlement;

/**
 * Moves token custody between a party and a pool. Called while the pool lock is held, as the last
 * step of a mutation whose other writes have already succeeded; a failure rolls them back.
 */
public interface SettlementService {
  /**
   * @return a receipt carrying the request's reference
   * @throws SettlementException when the transfer was not confirmed
   */
  SettlementReceipt settle(SettlementRequest request);
}
