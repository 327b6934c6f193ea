package com.warden.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DecisionLogContextHolder")
class DecisionLogContextHolderTest {

    @AfterEach
    void tearDown() {
        DecisionLogContextHolder.clear();
    }

    @Test
    @DisplayName("set() populates MDC and skips null values")
    void populatesMdc() {
        DecisionLogContextHolder.set(new DecisionLogContext("tenant-1", "user-1", "req-1", null));

        assertThat(MDC.get(DecisionLogContext.MDC_TENANT_ID)).isEqualTo("tenant-1");
        assertThat(MDC.get(DecisionLogContext.MDC_USER_ID)).isEqualTo("user-1");
        assertThat(MDC.get(DecisionLogContext.MDC_REQUEST_ID)).isEqualTo("req-1");
        assertThat(MDC.get(DecisionLogContext.MDC_SESSION_ID)).isNull();
    }

    @Test
    @DisplayName("set() rejects null")
    void rejectsNull() {
        assertThatThrownBy(() -> DecisionLogContextHolder.set(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("clear() removes context and MDC keys")
    void clears() {
        DecisionLogContextHolder.set(new DecisionLogContext("tenant-1", "user-1", "req-1", "sess-1"));
        DecisionLogContextHolder.clear();

        assertThat(DecisionLogContextHolder.get()).isEmpty();
        assertThat(MDC.get(DecisionLogContext.MDC_TENANT_ID)).isNull();
        assertThat(MDC.get(DecisionLogContext.MDC_SESSION_ID)).isNull();
    }

    @Test
    @DisplayName("callWithContext() restores the previous context")
    void restoresPrevious() {
        DecisionLogContext outer = new DecisionLogContext("tenant-1", "outer", null, null);
        DecisionLogContextHolder.set(outer);

        String seen = DecisionLogContextHolder.callWithContext(
                new DecisionLogContext("tenant-1", "inner", null, null),
                () -> MDC.get(DecisionLogContext.MDC_USER_ID));

        assertThat(seen).isEqualTo("inner");
        assertThat(DecisionLogContextHolder.get()).contains(outer);
        assertThat(MDC.get(DecisionLogContext.MDC_USER_ID)).isEqualTo("outer");
    }

    @Test
    @DisplayName("callWithContext() clears when there was no previous context, even on failure")
    void clearsAfterFailure() {
        assertThatThrownBy(() -> DecisionLogContextHolder.callWithContext(
                new DecisionLogContext("tenant-1", "user-1", null, null),
                () -> {
                    throw new IllegalStateException("boom");
                })).isInstanceOf(IllegalStateException.class);

        assertThat(DecisionLogContextHolder.get()).isEmpty();
        assertThat(MDC.get(DecisionLogContext.MDC_USER_ID)).isNull();
    }
}
