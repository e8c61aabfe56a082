package com.acme.wiring.configurator;

import com.acme.wiring.consumer.ConsumeContext;
import com.acme.wiring.consumer.ConsumerFactory;
import com.acme.wiring.consumer.MessageConsumer;
import com.acme.wiring.core.PermanentException;
import com.acme.wiring.endpoint.ConsumePipe;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Delivers a message to a consumer from its factory, bounded by concurrency and retries. */
class ConsumerMessagePipe<T> implements ConsumePipe {
  private static final Logger log = LoggerFactory.getLogger(ConsumerMessagePipe.class);

  private final ConsumerFactory<T> consumerFactory;
  private final Semaphore concurrency;
  private final int retryLimit;

  ConsumerMessagePipe(ConsumerFactory<T> consumerFactory, Integer concurrentMessageLimit, int retryLimit) {
    this.consumerFactory = consumerFactory;
    this.concurrency = concurrentMessageLimit == null ? null : new Semaphore(concurrentMessageLimit);
    this.retryLimit = retryLimit;
  }

  @Override
  public void send(ConsumeContext context) throws Exception {
    if (concurrency == null) {
      sendWithRetry(context);
      return;
    }
    concurrency.acquire();
    try {
      sendWithRetry(context);
    } finally {
      concurrency.release();
    }
  }

  private void sendWithRetry(ConsumeContext context) throws Exception {
    int attempt = 0;
    while (true) {
      try {
        consumerFactory.send(context, ConsumerMessagePipe::dispatch);
        return;
      } catch (PermanentException e) {
        log.warn("Permanent failure for {} id={}", context.messageType(), context.messageId(), e);
        throw e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while consuming {} id={}", context.messageType(), context.messageId());
        throw e;
      } catch (Exception e) {
        if (attempt >= retryLimit) {
          log.error(
              "Giving up on {} id={} after {} attempt(s)",
              context.messageType(),
              context.messageId(),
              attempt + 1,
              e);
          throw e;
        }
        attempt++;
        log.warn(
            "Retrying {} id={} ({}/{}): {}",
            context.messageType(),
            context.messageId(),
            attempt,
            retryLimit,
            e.getMessage());
      }
    }
  }

  private static <T> void dispatch(T consumer, ConsumeContext context) throws Exception {
    if (!(consumer instanceof MessageConsumer)) {
      throw new IllegalStateException(
          consumer.getClass().getName() + " does not implement " + MessageConsumer.class.getName());
    }
    ((MessageConsumer) consumer).consume(context);
  }
}
