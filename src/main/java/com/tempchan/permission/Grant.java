package com.tempchan.permission;

import java.util.EnumSet;
import java.util.Set;

public record Grant(GrantTarget target, Set<Permission> allow, Set<Permission> deny) {

    public Grant {
        allow = allow == null || allow.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(allow));
        deny = deny == null || deny.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(deny));
    }

    public static Grant allow(GrantTarget target, Permission... permissions) {
        return new Grant(target, Set.of(permissions), Set.of());
    }

    public static Grant deny(GrantTarget target, Permission... permissions) {
        return new Grant(target, Set.of(), Set.of(permissions));
    }

    public boolean allows(Permission permission) {
        return allow.contains(permission);
    }

    public boolean denies(Permission permission) {
        return deny.contains(permission);
    }
}
