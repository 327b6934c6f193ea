package com.warden.authz.model;

import com.warden.authz.condition.AttributeBags;

/**
 * One authorization question: may {@code subject} perform {@code action} on {@code resource}
 * in {@code context}?
 */
public record AuthorizationRequest(
        SubjectAttributes subject,
        ActionAttributes action,
        ResourceAttributes resource,
        ContextAttributes context) {

    public AuthorizationRequest {
        if (subject == null) {
            throw new IllegalArgumentException("subject must not be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource must not be null");
        }
        context = context == null ? new ContextAttributes(null, null, null, null, null, null) : context;
    }

    /** Map views of the four bags, for condition evaluation. */
    public AttributeBags attributeBags() {
        return new AttributeBags(
                subject.toAttributeMap(),
                action.toAttributeMap(),
                resource.toAttributeMap(),
                context.toAttributeMap());
    }
}
