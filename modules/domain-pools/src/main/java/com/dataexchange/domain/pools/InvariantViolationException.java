package com.dataexchange.domain.pools;

/** Internal arithmetic inconsistency detected while mutating a pool. Fatal for the mutation. */
public class InvariantViolationException extends RuntimeException {
  private final Pool before;
  private final Pool after;

  public InvariantViolationException(String message, Pool before, Pool after) {
    super(message);
    this.before = before;
    this.after = after;
  }

  public Pool before() {
    return before;
  }

  public Pool after() {
    return after;
  }
}
