package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.liquidity.LiquidityManager;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/liquidity")
public class LiquidityController {
  private final LiquidityManager liquidityManager;

  public LiquidityController(LiquidityManager liquidityManager) {
    this.liquidityManager = liquidityManager;
  }

  @PostMapping("/add")
  @PreAuthorize("hasRole('TRADER')")
  public ResponseEntity<AddLiquidityResponse> add(
      @Valid @RequestBody AddLiquidityRequest request) {
    return ResponseEntity.ok(
        AddLiquidityResponse.from(
            liquidityManager.addLiquidity(
                request.tokenA(),
                request.tokenB(),
                request.amountA(),
                request.amountB(),
                request.provider())));
  }

  @PostMapping("/remove")
  @PreAuthorize("hasRole('TRADER')")
  public ResponseEntity<RemoveLiquidityResponse> remove(
      @Valid @RequestBody RemoveLiquidityRequest request) {
    return ResponseEntity.ok(
        RemoveLiquidityResponse.from(
            liquidityManager.removeLiquidity(
                request.tokenA(), request.tokenB(), request.units(), request.provider())));
  }

  @GetMapping("/positions")
  @PreAuthorize("hasRole('TRADER')")
  public ResponseEntity<PositionsResponse> positions(@RequestParam("provider") String provider) {
    List<LiquidityPositionResponse> positions =
        liquidityManager.positionsFor(provider).stream()
            .map(LiquidityPositionResponse::from)
            .toList();
    return ResponseEntity.ok(new PositionsResponse(provider.trim(), positions));
  }
}
