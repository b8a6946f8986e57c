package com.deliium.drawingboard.auth;

import java.util.Map;
import java.util.OptionalLong;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

import org.springframework.stereotype.Component;

/**
 * Reads the user id stored in the servlet session at login. Push connections see the same value
 * because the WebSocket handshake copies the HTTP session attributes onto the connection.
 */
@Component
public class HttpSessionIdentityResolver implements IdentityResolver {

    /** Session attribute holding the logged-in user's id. */
    public static final String USER_ID_ATTRIBUTE = "userId";

    @Override
    public OptionalLong resolve(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return OptionalLong.empty();
        }
        return toUserId(session.getAttribute(USER_ID_ATTRIBUTE));
    }

    @Override
    public OptionalLong resolve(Map<String, Object> connectionAttributes) {
        if (connectionAttributes == null) {
            return OptionalLong.empty();
        }
        return toUserId(connectionAttributes.get(USER_ID_ATTRIBUTE));
    }

    private static OptionalLong toUserId(Object value) {
        if (value instanceof Number) {
            return OptionalLong.of(((Number) value).longValue());
        }
        return OptionalLong.empty();
    }
}
