package com.shadi.authz;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the permission strings the platform knows about.
 * <p>
 * Permissions travel through the engine as opaque strings: the identity provider may define
 * grants this enum does not list, and those still take part in decisions. The registry only lets
 * callers refer to well-known grants without typos and flag unfamiliar strings in logs.
 */
public enum Permission {

    // wedding events
    CREATE_EVENTS("create:events"),
    READ_EVENTS("read:events"),
    UPDATE_EVENTS("update:events"),
    DELETE_EVENTS("delete:events"),
    MANAGE_EVENTS("manage:events"),

    // couples and planners working with vendors
    VIEW_VENDORS("view:vendors"),
    READ_VENDORS("read:vendors"),
    INQUIRE_VENDORS("inquire:vendors"),
    CREATE_INQUIRIES("create:inquiries"),
    READ_INQUIRIES("read:inquiries"),
    RESPOND_INQUIRIES("respond:inquiries"),
    MANAGE_VENDOR_RELATIONSHIPS("manage:vendor_relationships"),

    // vendor organization scoped
    READ_VENDOR_INFO("read:vendor_info"),
    EDIT_VENDOR_INFO("edit:vendor_info"),
    UPDATE_VENDOR("update:vendor"),
    UPDATE_OWN_VENDOR("update:own_vendor"),
    MANAGE_VENDOR_BOOKINGS("manage:vendor_bookings"),
    READ_VENDOR_INQUIRIES("read:vendor_inquiries"),
    RESPOND_VENDOR_INQUIRIES("respond:vendor_inquiries"),
    VIEW_VENDOR_ANALYTICS("view:vendor_analytics"),
    MANAGE_VENDOR_TEAM("manage:vendor_team"),
    MANAGE_VENDOR_BUSINESS("manage:vendor_business"),
    MANAGE_VENDOR_IMAGES("manage:vendor_images"),

    // guests and schedules
    MANAGE_GUESTS("manage:guests"),
    READ_GUESTS("read:guests"),
    INVITE_GUESTS("invite:guests"),
    EDIT_SCHEDULES("edit:schedules"),
    READ_SCHEDULES("read:schedules"),

    // money and reporting
    MANAGE_PAYMENTS("manage:payments"),
    VIEW_PAYMENTS("view:payments"),
    ACCESS_ANALYTICS("access:analytics"),
    EXPORT_REPORTS("export:reports"),

    PLAN_WEDDING("plan:wedding"),
    VIEW_WEDDING("view:wedding"),

    // own account
    READ_OWN_PROFILE("read:own_profile"),
    UPDATE_OWN_PROFILE("update:own_profile"),
    INVITE_USERS("invite:users"),

    // platform administration
    ACCESS_ADMIN("access:admin"),
    MANAGE_VENDORS("manage:vendors"),
    SYNC_PERMISSIONS("sync:permissions");

    private static final Map<String, Permission> BY_VALUE = new HashMap<>();

    static {
        for (Permission permission : values()) {
            BY_VALUE.put(permission.value, permission);
        }
    }

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    /** The wire form, {@code verb:object}. */
    public String value() {
        return value;
    }

    public static Optional<Permission> fromString(String value) {
        return Optional.ofNullable(value == null ? null : BY_VALUE.get(value));
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }

    @Override
    public String toString() {
        return value;
    }
}
