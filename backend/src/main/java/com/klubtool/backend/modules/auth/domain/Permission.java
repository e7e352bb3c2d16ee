package com.klubtool.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of capability strings a {@link Role} may grant, each {@code <domain>.<action>}.
 */
public enum Permission {

    USER_VIEW("user", "view"),
    USER_CREATE("user", "create"),
    USER_EDIT("user", "edit"),
    USER_DELETE("user", "delete"),

    ROLE_VIEW("role", "view"),
    ROLE_CREATE("role", "create"),
    ROLE_EDIT("role", "edit"),
    ROLE_DELETE("role", "delete"),

    GROUP_VIEW("group", "view"),
    GROUP_CREATE("group", "create"),
    GROUP_EDIT("group", "edit"),
    GROUP_DELETE("group", "delete"),

    MOTION_VIEW("motion", "view"),
    MOTION_CREATE("motion", "create"),
    MOTION_EDIT("motion", "edit"),
    MOTION_DELETE("motion", "delete"),
    MOTION_VOTE("motion", "vote"),

    LOCAL_VIEW("local", "view"),
    LOCAL_CREATE("local", "create"),
    LOCAL_EDIT("local", "edit"),
    LOCAL_DELETE("local", "delete"),

    COUNCIL_VIEW("council", "view"),
    COUNCIL_CREATE("council", "create"),
    COUNCIL_EDIT("council", "edit"),
    COUNCIL_DELETE("council", "delete"),

    SESSION_VIEW("session", "view"),
    SESSION_CREATE("session", "create"),
    SESSION_EDIT("session", "edit"),
    SESSION_DELETE("session", "delete"),

    COMMITTEE_VIEW("committee", "view"),
    COMMITTEE_CREATE("committee", "create"),
    COMMITTEE_EDIT("committee", "edit"),
    COMMITTEE_DELETE("committee", "delete");

    private static final Map<String, Permission> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Permission::code, Function.identity()));

    private final String domain;
    private final String action;
    private final String code;

    Permission(String domain, String action) {
        this.domain = domain;
        this.action = action;
        this.code = domain + "." + action;
    }

    public String domain() {
        return domain;
    }

    public String action() {
        return action;
    }

    public String code() {
        return code;
    }

    public static Optional<Permission> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code.trim().toLowerCase()));
    }

    public static Optional<Permission> of(String domain, String action) {
        return Optional.ofNullable(BY_CODE.get(domain + "." + action));
    }

    /**
     * Parses stored codes, skipping anything that is not a known permission.
     */
    public static Set<Permission> parseKnown(Collection<String> codes) {
        Set<Permission> parsed = EnumSet.noneOf(Permission.class);
        if (codes != null) {
            for (String code : codes) {
                fromCode(code).ifPresent(parsed::add);
            }
        }
        return parsed;
    }
}
