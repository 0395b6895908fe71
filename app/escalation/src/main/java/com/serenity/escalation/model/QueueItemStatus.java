package com.serenity.escalation.model;

public enum QueueItemStatus {
  QUEUED,
  PROCESSING,
  SENT,
  DELIVERED,
  FAILED,
  CANCELLED
}
