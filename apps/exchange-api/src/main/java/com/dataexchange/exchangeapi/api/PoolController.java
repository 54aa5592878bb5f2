package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.pools.PoolQueryService;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/pools")
public class PoolController {
  private static final Duration DEFAULT_ACTIVITY_WINDOW = Duration.ofHours(24);

  private final PoolQueryService poolQueryService;

  public PoolController(PoolQueryService poolQueryService) {
    this.poolQueryService = poolQueryService;
  }

  @GetMapping
  public ResponseEntity<PoolsResponse> listPools() {
    List<PoolResponse> pools =
        poolQueryService.listPools().stream().map(PoolResponse::from).toList();
    return ResponseEntity.ok(new PoolsResponse(pools));
  }

  @GetMapping("/{tokenA}/{tokenB}")
  public ResponseEntity<PoolResponse> poolInfo(
      @PathVariable("tokenA") String tokenA, @PathVariable("tokenB") String tokenB) {
    return ResponseEntity.ok(PoolResponse.from(poolQueryService.poolInfo(tokenA, tokenB)));
  }

  @GetMapping("/{tokenA}/{tokenB}/activity")
  public ResponseEntity<PoolActivityResponse> activity(
      @PathVariable("tokenA") String tokenA,
      @PathVariable("tokenB") String tokenB,
      @RequestParam(name = "since", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant since) {
    Instant from = since != null ? since : Instant.now().minus(DEFAULT_ACTIVITY_WINDOW);
    return ResponseEntity.ok(
        PoolActivityResponse.from(poolQueryService.poolActivity(tokenA, tokenB, from)));
  }
}
