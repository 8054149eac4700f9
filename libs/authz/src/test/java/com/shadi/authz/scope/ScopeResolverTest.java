package com.shadi.authz.scope;

import com.shadi.authz.SubjectSnapshot;
import com.shadi.authz.testing.TestSnapshots;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScopeResolver")
class ScopeResolverTest {

    private final ScopeResolver resolver = new ScopeResolver();

    private final SubjectSnapshot u1 = TestSnapshots.subject("u1")
            .platform("read:events")
            .member("vendor-42", "owner", "manage:payments")
            .member("vendor-44", "representative")
            .build();

    @Nested
    @DisplayName("organization-owned resources")
    class Owned {

        @Test
        @DisplayName("use the grants of the owning organization's membership")
        void membershipGrants() {
            EffectivePermissions effective = resolver.scope(u1, ProtectedResource.vendor("v42", "vendor-42"));

            assertThat(effective.scope()).isEqualTo(EffectivePermissions.Scope.ORGANIZATION);
            assertThat(effective.organizationId()).isEqualTo("vendor-42");
            assertThat(effective.permissions())
                    .contains("manage:payments", "edit:vendor_info", "read:vendor_info")
                    .doesNotContain("read:events");
        }

        @Test
        @DisplayName("never carry grants from another organization")
        void isolation() {
            EffectivePermissions effective = resolver.scope(u1, ProtectedResource.vendor("v44", "vendor-44"));

            assertThat(effective.contains("respond:vendor_inquiries")).isTrue();
            assertThat(effective.contains("manage:payments")).isFalse();
            assertThat(effective.contains("edit:vendor_info")).isFalse();
        }

        @Test
        @DisplayName("are empty when the subject is not a member")
        void noMembership() {
            EffectivePermissions effective = resolver.scope(u1, ProtectedResource.vendor("v43", "vendor-43"));

            assertThat(effective.noMembership()).isTrue();
            assertThat(effective.permissions()).isEmpty();
            assertThat(effective.organizationId()).isEqualTo("vendor-43");
        }
    }

    @Nested
    @DisplayName("legacy resources without an owner")
    class Legacy {

        @Test
        @DisplayName("fall back to the subject's global permissions")
        void globalFallback() {
            EffectivePermissions effective = resolver.scope(u1, ProtectedResource.vendor("v-old", null));

            assertThat(effective.scope()).isEqualTo(EffectivePermissions.Scope.GLOBAL);
            assertThat(effective.organizationId()).isNull();
            assertThat(effective.permissions()).isEqualTo(u1.globalPermissions());
        }

        @Test
        @DisplayName("treat a blank owner like a missing one")
        void blankOwner() {
            ProtectedResource resource = new ProtectedResource("vendor", "v-old", "  ");

            assertThat(resource.isLegacy()).isTrue();
            assertThat(resolver.scope(u1, resource).scope()).isEqualTo(EffectivePermissions.Scope.GLOBAL);
        }

        @Test
        @DisplayName("grant nothing to a subject without any grants")
        void emptySubject() {
            EffectivePermissions effective = resolver.scope(SubjectSnapshot.empty("u9"),
                    ProtectedResource.vendor("v-old", null));

            assertThat(effective.permissions()).isEmpty();
            assertThat(effective.noMembership()).isFalse();
        }
    }

    @Nested
    @DisplayName("roles")
    class Roles {

        private final SubjectSnapshot planner = TestSnapshots.subject("u1")
                .roles("planner")
                .member("vendor-42", "owner")
                .member("vendor-44", "representative")
                .member("vendor-45", null)
                .build();

        @Test
        @DisplayName("are the membership role of the owning organization only")
        void membershipRole() {
            EffectiveRoles roles = resolver.scopeRoles(planner, ProtectedResource.vendor("v44", "vendor-44"));

            assertThat(roles.roles()).containsExactly("representative");
            assertThat(roles.hasAny(Set.of("owner"))).isFalse();
            assertThat(roles.hasAny(Set.of("Representative", "manager"))).isTrue();
            assertThat(roles.hasAny(Set.of("planner"))).isFalse();
        }

        @Test
        @DisplayName("are empty outside the subject's organizations")
        void noMembership() {
            EffectiveRoles roles = resolver.scopeRoles(planner, ProtectedResource.vendor("v43", "vendor-43"));

            assertThat(roles.noMembership()).isTrue();
            assertThat(roles.hasAny(Set.of("owner", "representative"))).isFalse();
        }

        @Test
        @DisplayName("are empty for a membership without a role")
        void roleless() {
            EffectiveRoles roles = resolver.scopeRoles(planner, ProtectedResource.vendor("v45", "vendor-45"));

            assertThat(roles.scope()).isEqualTo(EffectivePermissions.Scope.ORGANIZATION);
            assertThat(roles.roles()).isEmpty();
        }

        @Test
        @DisplayName("fall back to platform roles on legacy resources")
        void legacy() {
            EffectiveRoles roles = resolver.scopeRoles(planner, ProtectedResource.vendor("v-old", null));

            assertThat(roles.scope()).isEqualTo(EffectivePermissions.Scope.GLOBAL);
            assertThat(roles.roles()).containsExactly("planner");
        }
    }

    @Test
    @DisplayName("a resource needs an id")
    void resourceNeedsId() {
        assertThatThrownBy(() -> ProtectedResource.vendor(" ", "vendor-42"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
