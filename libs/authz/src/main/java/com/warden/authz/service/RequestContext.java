package com.warden.authz.service;

import java.util.Map;

/**
 * Transport-level facts about the incoming call.
 *
 * @param ipAddress client address
 * @param userAgent client user agent
 * @param requestId correlation id
 * @param sessionId session id, may be null
 * @param metadata  extra attributes for policy conditions
 */
public record RequestContext(
        String ipAddress,
        String userAgent,
        String requestId,
        String sessionId,
        Map<String, Object> metadata) {

    public RequestContext {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static RequestContext empty() {
        return new RequestContext(null, null, null, null, null);
    }
}
