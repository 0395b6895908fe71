package com.serenity.escalation.model;

/**
 * Queue item as returned by a claim, with the status and owner it had just before. A reclaimed
 * item comes back from PROCESSING with the owner whose lease ran out.
 */
public record ClaimedQueueItem(
    QueueItemRecord item, QueueItemStatus previousStatus, String previousOwner) {

  public boolean reclaimed() {
    return previousStatus == QueueItemStatus.PROCESSING;
  }
}
