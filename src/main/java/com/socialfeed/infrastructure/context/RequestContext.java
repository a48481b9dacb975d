package com.socialfeed.infrastructure.context;

import com.socialfeed.domain.model.UserId;
import org.slf4j.MDC;

/**
 * Per-thread identity of the work being done (a WebSocket session, a pub/sub message, a worker run),
 * mirrored into the logging MDC.
 */
public final class RequestContext {

    private static final String USER_ID_KEY = "userId";
    private static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(UserId userId, String requestId) {
        currentRequestId.set(requestId);
        if (userId != null) {
            MDC.put(USER_ID_KEY, userId.toString());
        }
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void clear() {
        currentRequestId.remove();
        MDC.remove(USER_ID_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }
}
