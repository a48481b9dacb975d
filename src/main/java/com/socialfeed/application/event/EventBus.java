package com.socialfeed.application.event;

import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.domain.event.DomainEvent;
import com.socialfeed.infrastructure.context.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process event dispatch with a commit-then-publish outbox.
 * <p>
 * {@link #publish} runs every matching handler synchronously, in registration order, isolating failures.
 * {@link #queueTransactional} holds events in a per-transaction queue that is flushed in enqueue order
 * once the transaction commits and dropped if it rolls back, so nothing downstream ever hears about a
 * write that did not commit.
 */
@Component
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ObjectProvider<DomainEventHandler<?>> handlerProvider;
    private final MetricsPort metrics;
    private final List<DomainEventHandler<?>> handlers = new CopyOnWriteArrayList<>();
    private volatile boolean discovered;

    @Autowired
    public EventBus(ObjectProvider<DomainEventHandler<?>> handlerProvider, MetricsPort metrics) {
        this.handlerProvider = handlerProvider;
        this.metrics = metrics;
    }

    public EventBus(List<DomainEventHandler<?>> handlers, MetricsPort metrics) {
        this.handlerProvider = null;
        this.metrics = metrics;
        this.handlers.addAll(handlers);
        this.discovered = true;
    }

    public void register(DomainEventHandler<?> handler) {
        registeredHandlers().add(handler);
        log.debug("Registered {} for {}", handler.getClass().getSimpleName(), handler.eventType().getSimpleName());
    }

    public void publish(DomainEvent event) {
        List<DomainEventHandler<?>> matching = registeredHandlers().stream()
            .filter(h -> h.eventType().isInstance(event))
            .toList();

        if (matching.isEmpty()) {
            log.debug("No handlers for event: type={}, id={}", event.eventType(), event.eventId());
            return;
        }

        log.debug("Publishing event: type={}, id={}, handlers={}", event.eventType(), event.eventId(), matching.size());
        for (DomainEventHandler<?> handler : matching) {
            invoke(handler, event);
        }
    }

    /**
     * Queues the event for every registered handler once the current transaction commits.
     * Outside a transaction the write has already committed and the event is published immediately.
     */
    public void queueTransactional(DomainEvent event) {
        enqueue(new PendingEvent(event, null));
    }

    /**
     * Queues the event for a single handler once the current transaction commits.
     */
    public <E extends DomainEvent> void queueTransactional(E event, DomainEventHandler<? super E> handler) {
        enqueue(new PendingEvent(event, handler));
    }

    private void enqueue(PendingEvent pending) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            log.debug("No active transaction, dispatching {} immediately", pending.event().eventType());
            dispatch(pending);
            return;
        }

        OutboxSynchronization outbox = currentOutbox();
        if (outbox == null) {
            outbox = new OutboxSynchronization();
            TransactionSynchronizationManager.registerSynchronization(outbox);
        } else if (outbox.flushing) {
            // queued by a handler while flushing: the transaction has already committed
            dispatch(pending);
            return;
        }
        outbox.events.add(pending);
        log.debug("Queued {} until commit ({} pending)", pending.event().eventType(), outbox.events.size());
    }

    private OutboxSynchronization currentOutbox() {
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            if (synchronization instanceof OutboxSynchronization outbox && outbox.owner() == this) {
                return outbox;
            }
        }
        return null;
    }

    private void dispatch(PendingEvent pending) {
        if (pending.handler() == null) {
            publish(pending.event());
        } else {
            invoke(pending.handler(), pending.event());
        }
    }

    private <E extends DomainEvent> void invoke(DomainEventHandler<E> handler, DomainEvent event) {
        try {
            handler.handle(handler.eventType().cast(event));
        } catch (Exception e) {
            metrics.incrementEventHandlerFailures(event.eventType());
            log.error("Event handler failed: handler={}, type={}, id={}, requestId={}, error={}",
                handler.getClass().getSimpleName(), event.eventType(), event.eventId(),
                RequestContext.getRequestId(), e.getMessage(), e);
        }
    }

    private List<DomainEventHandler<?>> registeredHandlers() {
        if (!discovered) {
            synchronized (this) {
                if (!discovered) {
                    handlerProvider.orderedStream().forEach(handlers::add);
                    discovered = true;
                    log.info("Event bus initialized with {} handlers", handlers.size());
                }
            }
        }
        return handlers;
    }

    private record PendingEvent(DomainEvent event, DomainEventHandler<?> handler) {}

    private final class OutboxSynchronization implements TransactionSynchronization {

        private final List<PendingEvent> events = new ArrayList<>();
        private boolean flushing;

        private EventBus owner() {
            return EventBus.this;
        }

        @Override
        public void afterCommit() {
            flushing = true;
            log.debug("Transaction committed, flushing {} queued events", events.size());
            for (PendingEvent pending : List.copyOf(events)) {
                dispatch(pending);
            }
            events.clear();
        }

        @Override
        public void afterCompletion(int status) {
            if (status != STATUS_COMMITTED && !events.isEmpty()) {
                log.info("Transaction did not commit, discarding {} queued events", events.size());
            }
            events.clear();
        }
    }
}
