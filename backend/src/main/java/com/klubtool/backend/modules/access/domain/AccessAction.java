package com.klubtool.backend.modules.access.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum AccessAction {
    LIST("view"),
    VIEW("view"),
    CREATE("create"),
    EDIT("edit"),
    DELETE("delete"),
    VOTE("vote");

    private final String permissionAction;

    AccessAction(String permissionAction) {
        this.permissionAction = permissionAction;
    }

    /**
     * Actions every resource type defines a rule for. {@link #VOTE} exists for motions only.
     */
    public static final Set<AccessAction> CRUD = Collections.unmodifiableSet(EnumSet.range(LIST, DELETE));

    /**
     * Action segment of the permission string that grants this action. Listing is granted by {@code view}.
     */
    public String permissionAction() {
        return permissionAction;
    }
}
