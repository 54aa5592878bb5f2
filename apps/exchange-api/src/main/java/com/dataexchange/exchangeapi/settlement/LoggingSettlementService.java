package com.dataexchange.exchangeapi.settlement;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Confirms every transfer immediately and only logs it. Used until a custody backend is wired. */
public class LoggingSettlementService implements SettlementService {
  private static final Logger log = LoggerFactory.getLogger(LoggingSettlementService.class);

  @Override
  public SettlementReceipt settle(SettlementRequest request) {
    log.info(
        "Settlement kind={} party={} pairKey={} legs={} reference={}",
        request.kind(),
        request.party(),
        request.pairKey(),
        request.legs(),
        request.reference());
    return new SettlementReceipt(request.reference(), Instant.now());
  }
}
