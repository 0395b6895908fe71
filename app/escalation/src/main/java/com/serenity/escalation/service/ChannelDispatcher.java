/*
 * Where: escalation service layer
 * What: routes a message to the first sender supporting its channel and bounds the call
 * Why: a hung transport must surface as a retryable timeout instead of stalling the processor
 */
package com.serenity.escalation.service;

import com.serenity.escalation.model.ChannelMessage;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class ChannelDispatcher {

  private final List<ChannelSender> senders;
  private final Executor executor;

  public ChannelDispatcher(
      List<ChannelSender> senders, @Qualifier("channelSenderExecutor") Executor executor) {
    this.senders = List.copyOf(senders);
    this.executor = executor;
  }

  public String dispatch(ChannelMessage message, Duration timeout) {
    final ChannelSender sender =
        senders.stream()
            .filter(candidate -> candidate.supports(message.channel()))
            .findFirst()
            .orElseThrow(
                () ->
                    new PermanentChannelDeliveryException(
                        "no sender supports channel " + message.channel()));
    final CompletableFuture<String> future;
    try {
      future = CompletableFuture.supplyAsync(() -> sender.send(message), executor);
    } catch (RejectedExecutionException ex) {
      throw new ChannelDeliveryException("sender pool saturated", ex);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new ChannelDeliveryException("sender timed out after " + timeout, ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ChannelDeliveryException("interrupted while sending", ex);
    } catch (ExecutionException ex) {
      throw unwrap(ex.getCause());
    }
  }

  private RuntimeException unwrap(Throwable cause) {
    final Throwable actual = cause instanceof CompletionException && cause.getCause() != null
        ? cause.getCause()
        : cause;
    if (actual instanceof PermanentChannelDeliveryException permanent) {
      return permanent;
    }
    if (actual instanceof ChannelDeliveryException transientFailure) {
      return transientFailure;
    }
    return new ChannelDeliveryException("sender failed: " + actual.getMessage(), actual);
  }
}
