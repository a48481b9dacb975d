package com.socialfeed.adapter.in.realtime;

import com.socialfeed.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Rejects handshakes that do not identify the user, through the {@code X-User-Id} header or a
 * {@code userId} query parameter, with a valid user id.
 */
public class UserIdHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(UserIdHandshakeInterceptor.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ID_PARAM = "userId";
    public static final String USER_ID_ATTRIBUTE = "socialfeed.userId";

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes) {
        String raw = request.getHeaders().getFirst(USER_ID_HEADER);
        if (raw == null || raw.isBlank()) {
            raw = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst(USER_ID_PARAM);
        }

        var parsed = UserId.parse(raw);
        if (parsed.isFailure()) {
            log.debug("Rejecting realtime handshake from {}: {}", request.getRemoteAddress(), parsed.errorOrNull().message());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        attributes.put(USER_ID_ATTRIBUTE, parsed.getOrThrow());
        return true;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Exception exception) {
    }
}
