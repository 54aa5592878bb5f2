package com.dataexchange.domain.pools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PairKeyTest {
  @Test
  void shouldResolveSamePoolRegardlessOfOrder() {
    PairKey forward = PairKey.of("0xbbb", "0xaaa");
    PairKey backward = PairKey.of("0xaaa", "0xbbb");

    assertEquals(forward, backward);
    assertEquals("0xaaa", forward.tokenA());
    assertEquals("0xaaa:0xbbb", forward.value());
  }

  @Test
  void shouldTrimTokensAndParseValue() {
    PairKey key = PairKey.parse(" 0xbbb :0xaaa");

    assertEquals(PairKey.of("0xaaa", "0xbbb"), key);
    assertTrue(key.isTokenA("0xaaa"));
    assertFalse(key.isTokenA("0xbbb"));
    assertEquals("0xaaa", key.counterpart("0xbbb"));
  }

  @Test
  void shouldRejectIdenticalOrBlankTokens() {
    assertThrows(InvalidTokenPairException.class, () -> PairKey.of("0xaaa", "0xaaa"));
    assertThrows(InvalidTokenPairException.class, () -> PairKey.of(" ", "0xaaa"));
    assertThrows(InvalidTokenPairException.class, () -> PairKey.parse("0xaaa"));
    assertThrows(InvalidTokenPairException.class, () -> new PairKey("0xbbb", "0xaaa"));
  }

  @Test
  void shouldRejectForeignToken() {
    PairKey key = PairKey.of("0xaaa", "0xbbb");
    assertThrows(InvalidTokenPairException.class, () -> key.isTokenA("0xccc"));
  }
}
