package com.deliium.drawingboard.auth;

import java.util.Map;
import java.util.OptionalLong;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves which user, if any, is behind a request or a push connection. */
public interface IdentityResolver {

    OptionalLong resolve(HttpServletRequest request);

    /** Resolves from the attributes captured when a push connection was upgraded. */
    OptionalLong resolve(Map<String, Object> connectionAttributes);
}
