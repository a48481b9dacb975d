package com.socialfeed.adapter.in.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.infrastructure.context.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Routes messages from the realtime channels to the handler registered for their type.
 * <p>
 * Messages without a resolvable type are logged and dropped; a failing handler never stops the
 * listener thread.
 */
@Component
public class RealtimeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RealtimeDispatcher.class);

    static final String MDC_CHANNEL = "channel";
    static final String MDC_TYPE = "type";

    private final Map<RealtimeMessageType, RealtimeMessageHandler> handlers = new EnumMap<>(RealtimeMessageType.class);
    private final ConnectionRegistry connections;
    private final ObjectMapper objectMapper;
    private final MetricsPort metrics;

    public RealtimeDispatcher(
            List<RealtimeMessageHandler> handlers,
            ConnectionRegistry connections,
            ObjectMapper objectMapper,
            MetricsPort metrics) {
        this.connections = connections;
        this.objectMapper = objectMapper;
        this.metrics = metrics;

        for (RealtimeMessageHandler handler : handlers) {
            RealtimeMessageHandler previous = this.handlers.putIfAbsent(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate realtime handler for " + handler.type().wireName() + ": "
                    + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }

        Set<RealtimeMessageType> unhandled = EnumSet.allOf(RealtimeMessageType.class);
        unhandled.removeAll(this.handlers.keySet());
        if (!unhandled.isEmpty()) {
            log.warn("No realtime handler registered for {}", unhandled);
        }
        log.info("Realtime dispatcher ready with {} handlers", this.handlers.size());
    }

    /**
     * @param raw a JSON string, a {@link JsonNode} or any object Jackson can turn into a tree (typically a Map)
     */
    public void dispatch(String channel, Object raw) {
        RequestContext.set(null, "rt-" + UUID.randomUUID());
        try {
            route(channel, raw);
        } finally {
            RequestContext.clear();
        }
    }

    private void route(String channel, Object raw) {
        Optional<JsonNode> body = toTree(channel, raw);
        if (body.isEmpty()) {
            metrics.incrementRealtimeDropped("unparseable");
            return;
        }

        JsonNode typeNode = body.get().get("type");
        String typeName = typeNode != null && typeNode.isTextual() ? typeNode.textValue() : null;
        Optional<RealtimeMessageType> type = RealtimeMessageType.resolve(typeName);
        if (type.isEmpty()) {
            log.warn("Dropping realtime message with unknown type '{}' on {}", typeName, channel);
            metrics.incrementRealtimeDropped("unknown_type");
            return;
        }

        RealtimeMessageHandler handler = handlers.get(type.get());
        if (handler == null) {
            log.warn("Dropping realtime message of type {} on {}: no handler", type.get().wireName(), channel);
            metrics.incrementRealtimeDropped("no_handler");
            return;
        }

        try (MDC.MDCCloseable channelField = MDC.putCloseable(MDC_CHANNEL, channel);
             MDC.MDCCloseable typeField = MDC.putCloseable(MDC_TYPE, type.get().wireName())) {
            handler.handle(connections, new RealtimeMessage(type.get(), body.get()), channel);
            metrics.incrementRealtimeDispatched(type.get().wireName());
        } catch (RuntimeException e) {
            metrics.incrementRealtimeDropped("handler_error");
            log.error("Realtime handler {} failed on {}: {}", handler.getClass().getSimpleName(), channel, e.getMessage(), e);
        }
    }

    Map<RealtimeMessageType, RealtimeMessageHandler> registeredHandlers() {
        return Collections.unmodifiableMap(handlers);
    }

    private Optional<JsonNode> toTree(String channel, Object raw) {
        if (raw == null) {
            log.warn("Dropping empty realtime message on {}", channel);
            return Optional.empty();
        }
        try {
            JsonNode tree;
            if (raw instanceof JsonNode node) {
                tree = node;
            } else if (raw instanceof String text) {
                tree = objectMapper.readTree(text);
            } else {
                tree = objectMapper.valueToTree(raw);
            }
            if (tree == null || !tree.isObject()) {
                log.warn("Dropping non-object realtime message on {}", channel);
                return Optional.empty();
            }
            return Optional.of(tree);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping unparseable realtime message on {}: {}", channel, e.getMessage());
            return Optional.empty();
        }
    }
}
