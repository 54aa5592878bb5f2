package com.dataexchange.exchangeapi.api;

import com.dataexchange.domain.trades.Trade;
import com.dataexchange.exchangeapi.trades.TradeQueryService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/trades")
public class TradeController {
  private final TradeQueryService tradeQueryService;

  public TradeController(TradeQueryService tradeQueryService) {
    this.tradeQueryService = tradeQueryService;
  }

  @GetMapping("/recent")
  public ResponseEntity<TradesResponse> recent(
      @RequestParam(name = "limit", defaultValue = "20") int limit) {
    return ResponseEntity.ok(toResponse(tradeQueryService.recentTrades(limit)));
  }

  @GetMapping
  public ResponseEntity<TradesResponse> find(
      @RequestParam(name = "pool", required = false) String pool,
      @RequestParam(name = "trader", required = false) String trader,
      @RequestParam(name = "token", required = false) String token,
      @RequestParam(name = "limit", defaultValue = "20") int limit) {
    return ResponseEntity.ok(
        toResponse(tradeQueryService.findTrades(pool, trader, token, limit)));
  }

  @GetMapping("/traders/{trader}/activity")
  public ResponseEntity<TraderActivityResponse> traderActivity(
      @PathVariable("trader") String trader) {
    return ResponseEntity.ok(
        TraderActivityResponse.from(tradeQueryService.traderActivity(trader)));
  }

  private static TradesResponse toResponse(List<Trade> trades) {
    List<TradeResponse> items = trades.stream().map(TradeResponse::from).toList();
    return new TradesResponse(items, items.size());
  }
}
