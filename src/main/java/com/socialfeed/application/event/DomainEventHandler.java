package com.socialfeed.application.event;

import com.socialfeed.domain.event.DomainEvent;

/**
 * In-process reaction to a committed domain event.
 * <p>
 * Handlers run after the originating transaction has committed, so they must not write to the
 * database through the caller's transaction. A handler may see the same logical change more than
 * once (the cross-process channel is at-least-once) and must be idempotent.
 */
public interface DomainEventHandler<E extends DomainEvent> {

    Class<E> eventType();

    void handle(E event);
}
