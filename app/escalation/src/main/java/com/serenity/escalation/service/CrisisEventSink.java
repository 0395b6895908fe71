package com.serenity.escalation.service;

import com.serenity.escalation.model.CrisisLifecycleEvent;

/** Receives crisis lifecycle events; called inside the state change's transaction. */
public interface CrisisEventSink {

  void emit(CrisisLifecycleEvent event);
}
