package com.shadi.authz;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role a person holds inside one vendor organization.
 * <p>
 * Each role implies a bundle of organization-scoped permissions. The bundle is added to whatever
 * the identity provider granted explicitly for that membership, never to other organizations.
 */
public enum VendorRole {

    OWNER("owner"),
    MANAGER("manager"),
    EMPLOYEE("employee"),
    REPRESENTATIVE("representative");

    private static final Set<Permission> BASE = EnumSet.of(
            Permission.READ_VENDOR_INFO,
            Permission.READ_VENDOR_INQUIRIES);

    private final String value;

    VendorRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Permissions implied by this role:
     * <ul>
     *   <li>every role reads vendor info and vendor inquiries</li>
     *   <li>OWNER and MANAGER also edit info, manage bookings and team, respond to inquiries and
     *       view analytics</li>
     *   <li>EMPLOYEE also manages bookings and responds to inquiries</li>
     *   <li>REPRESENTATIVE also responds to inquiries</li>
     * </ul>
     */
    public Set<Permission> impliedPermissions() {
        EnumSet<Permission> bundle = EnumSet.copyOf(BASE);
        switch (this) {
            case OWNER, MANAGER -> bundle.addAll(EnumSet.of(
                    Permission.EDIT_VENDOR_INFO,
                    Permission.MANAGE_VENDOR_BOOKINGS,
                    Permission.RESPOND_VENDOR_INQUIRIES,
                    Permission.VIEW_VENDOR_ANALYTICS,
                    Permission.MANAGE_VENDOR_TEAM));
            case EMPLOYEE -> bundle.addAll(EnumSet.of(
                    Permission.MANAGE_VENDOR_BOOKINGS,
                    Permission.RESPOND_VENDOR_INQUIRIES));
            case REPRESENTATIVE -> bundle.add(Permission.RESPOND_VENDOR_INQUIRIES);
        }
        return bundle;
    }

    /** {@link #impliedPermissions()} in wire form. */
    public Set<String> impliedPermissionValues() {
        return impliedPermissions().stream()
                .map(Permission::value)
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Case-insensitive lookup; empty for null or unknown role names. */
    public static Optional<VendorRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (VendorRole role : values()) {
            if (role.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
