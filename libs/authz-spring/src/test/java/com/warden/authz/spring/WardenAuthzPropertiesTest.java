package com.warden.authz.spring;

import com.warden.authz.rbac.PermissionResolverConfig;
import com.warden.authz.service.AuthorizationServiceConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WardenAuthzProperties")
class WardenAuthzPropertiesTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("fills in every unset field")
        void appliesDefaults() {
            var props = WardenAuthzProperties.defaults();

            assertThat(props.serviceName()).isEqualTo(WardenAuthzProperties.DEFAULT_SERVICE_NAME);
            assertThat(props.cacheTtl()).isEqualTo(Duration.ofSeconds(60));
            assertThat(props.maxInheritanceDepth()).isEqualTo(5);
            assertThat(props.enableAbac()).isTrue();
            assertThat(props.requireBoth()).isTrue();
            assertThat(props.auditEnabled()).isTrue();
            assertThat(props.policyLocation()).isNull();
        }

        @Test
        @DisplayName("treats a blank policy location as unset")
        void blankLocation() {
            var props = new WardenAuthzProperties("svc", null, 0, null, null, null, "  ");

            assertThat(props.policyLocation()).isNull();
        }

        @Test
        @DisplayName("rejects a non-positive cache TTL")
        void rejectsZeroTtl() {
            assertThatThrownBy(() -> new WardenAuthzProperties("svc", Duration.ZERO, 5, null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cache-ttl");
        }
    }

    @Test
    @DisplayName("converts to engine configs")
    void converts() {
        var props = new WardenAuthzProperties("svc", Duration.ofMinutes(2), 3, true, false, false, null);

        assertThat(props.resolverConfig()).isEqualTo(new PermissionResolverConfig(Duration.ofMinutes(2), 3));
        assertThat(props.serviceConfig()).isEqualTo(new AuthorizationServiceConfig(true, false, false));
    }
}
