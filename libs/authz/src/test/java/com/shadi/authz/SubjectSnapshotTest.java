package com.shadi.authz;

import com.shadi.authz.testing.TestSnapshots;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SubjectSnapshot")
class SubjectSnapshotTest {

    @Nested
    @DisplayName("globalPermissions()")
    class GlobalPermissions {

        @Test
        @DisplayName("is the union of platform grants and every membership's effective grants")
        void unionOfEverything() {
            SubjectSnapshot snapshot = TestSnapshots.subject("u1")
                    .platform("read:events")
                    .member("vendor-42", null, "manage:payments")
                    .member("vendor-43", "representative")
                    .build();

            assertThat(snapshot.globalPermissions())
                    .contains("read:events", "manage:payments", "respond:vendor_inquiries", "read:vendor_info");
        }

        @Test
        @DisplayName("contains every organization grant")
        void supersetOfEachMembership() {
            SubjectSnapshot snapshot = TestSnapshots.subject("u1")
                    .member("vendor-42", "owner", "export:reports")
                    .member("vendor-43", "employee", "view:payments")
                    .build();

            snapshot.memberships().values().forEach(membership ->
                    assertThat(snapshot.globalPermissions()).containsAll(membership.effectivePermissions()));
        }

        @Test
        @DisplayName("of an empty snapshot is empty")
        void emptySnapshot() {
            SubjectSnapshot empty = SubjectSnapshot.empty("u1");

            assertThat(empty.globalPermissions()).isEmpty();
            assertThat(empty.isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("unknown vendor roles add nothing beyond explicit grants")
    void unknownRoleAddsNothing() {
        OrganizationMembership membership =
                new OrganizationMembership("vendor-42", "intern", Set.of("read:vendor_info"));

        assertThat(membership.vendorRole()).isEmpty();
        assertThat(membership.effectivePermissions()).containsExactly("read:vendor_info");
    }

    @Test
    @DisplayName("rejects a membership filed under another organization's id")
    void rejectsMisfiledMembership() {
        OrganizationMembership membership = new OrganizationMembership("vendor-43", "owner", Set.of());

        assertThatThrownBy(() -> new SubjectSnapshot("u1", Set.of(), Set.of(), Map.of("vendor-42", membership)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("vendor-42");
    }

    @Test
    @DisplayName("is immutable")
    void immutable() {
        SubjectSnapshot snapshot = TestSnapshots.subject("u1").platform("read:events").build();

        assertThatThrownBy(() -> snapshot.platformPermissions().add("manage:payments"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
