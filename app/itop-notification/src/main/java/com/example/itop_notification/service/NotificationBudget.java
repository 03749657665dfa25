package com.example.itop_notification.service;

/** Per-user, per-run notification allowance shared by every detection step. */
public final class NotificationBudget {

  private final int limit;
  private int used;

  public NotificationBudget(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    this.limit = limit;
  }

  public int remaining() {
    return limit - used;
  }

  public int used() {
    return used;
  }

  public boolean isExhausted() {
    return remaining() <= 0;
  }

  public void consume(int count) {
    if (count < 0 || count > remaining()) {
      throw new IllegalStateException(
          "notification budget exceeded requested=" + count + " remaining=" + remaining());
    }
    used += count;
  }
}
