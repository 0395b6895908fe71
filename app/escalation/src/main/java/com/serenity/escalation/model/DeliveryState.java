/*
 * Where: escalation model
 * What: per-recipient delivery state with its rank
 * Why: the latest-status view only moves to a higher rank
 */
package com.serenity.escalation.model;

public enum DeliveryState {
  SENT(0),
  FAILED(1),
  DELIVERED(2),
  ACKNOWLEDGED(3);

  private final int rank;

  DeliveryState(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }
}
