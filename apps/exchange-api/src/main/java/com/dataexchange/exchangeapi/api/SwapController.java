package com.dataexchange.exchangeapi.api;

import com.dataexchange.domain.trades.Trade;
import com.dataexchange.exchangeapi.swaps.ExecuteSwapCommand;
import com.dataexchange.exchangeapi.swaps.SwapExecutor;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class SwapController {
  private final SwapExecutor swapExecutor;

  public SwapController(SwapExecutor swapExecutor) {
    this.swapExecutor = swapExecutor;
  }

  @GetMapping("/quote")
  public ResponseEntity<QuoteResponse> quote(
      @RequestParam("tokenIn") String tokenIn,
      @RequestParam("tokenOut") String tokenOut,
      @RequestParam("amountIn") BigDecimal amountIn) {
    return ResponseEntity.ok(
        QuoteResponse.from(swapExecutor.getQuote(tokenIn, tokenOut, amountIn)));
  }

  @PostMapping("/swaps")
  @PreAuthorize("hasRole('TRADER')")
  public ResponseEntity<TradeResponse> swap(@Valid @RequestBody SwapRequest request) {
    Trade trade =
        swapExecutor.executeSwap(
            new ExecuteSwapCommand(
                request.tokenIn(),
                request.tokenOut(),
                request.amountIn(),
                request.minAmountOut(),
                request.trader(),
                request.clientTradeId()));
    return ResponseEntity.ok(TradeResponse.from(trade));
  }
}
