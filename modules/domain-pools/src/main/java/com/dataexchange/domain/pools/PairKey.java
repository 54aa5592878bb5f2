package com.dataexchange.domain.pools;

/**
 * Order-independent identifier of a pool. {@code tokenA} always sorts before {@code tokenB}, so
 * {@code of(x, y)} and {@code of(y, x)} are equal.
 */
public record PairKey(String tokenA, String tokenB) {
  private static final String SEPARATOR = ":";

  public PairKey {
    tokenA = requireToken(tokenA, "tokenA");
    tokenB = requireToken(tokenB, "tokenB");
    if (tokenA.compareTo(tokenB) >= 0) {
      throw new InvalidTokenPairException(
          "PairKey tokens must be distinct and in canonical order: " + tokenA + ", " + tokenB);
    }
  }

  public static PairKey of(String firstToken, String secondToken) {
    String first = requireToken(firstToken, "token");
    String second = requireToken(secondToken, "token");
    int cmp = first.compareTo(second);
    if (cmp == 0) {
      throw new InvalidTokenPairException("A pool needs two distinct tokens, got " + first + " twice");
    }
    return cmp < 0 ? new PairKey(first, second) : new PairKey(second, first);
  }

  public static PairKey parse(String value) {
    if (value == null) {
      throw new InvalidTokenPairException("pair key must not be null");
    }
    int idx = value.indexOf(SEPARATOR);
    if (idx <= 0 || idx == value.length() - 1 || value.indexOf(SEPARATOR, idx + 1) >= 0) {
      throw new InvalidTokenPairException("Malformed pair key: " + value);
    }
    return of(value.substring(0, idx), value.substring(idx + 1));
  }

  public boolean contains(String token) {
    return tokenA.equals(token) || tokenB.equals(token);
  }

  /** True when {@code token} is the canonical first token of this pair. */
  public boolean isTokenA(String token) {
    if (!contains(token)) {
      throw new InvalidTokenPairException("Token " + token + " is not part of pool " + value());
    }
    return tokenA.equals(token);
  }

  public String counterpart(String token) {
    return isTokenA(token) ? tokenB : tokenA;
  }

  public String value() {
    return tokenA + SEPARATOR + tokenB;
  }

  @Override
  public String toString() {
    return value();
  }

  private static String requireToken(String token, String fieldName) {
    if (token == null || token.isBlank()) {
      throw new InvalidTokenPairException(fieldName + " must not be blank");
    }
    String trimmed = token.trim();
    if (trimmed.contains(SEPARATOR)) {
      throw new InvalidTokenPairException(fieldName + " must not contain '" + SEPARATOR + "'");
    }
    return trimmed;
  }
}
