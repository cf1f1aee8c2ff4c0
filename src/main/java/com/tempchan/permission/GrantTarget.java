package com.tempchan.permission;

import java.util.Objects;

public record GrantTarget(Type type, String id) {

    public enum Type {
        /** The scope-wide default role every member has. */
        EVERYONE,
        /** The bot account itself. */
        SELF,
        MEMBER,
        ROLE
    }

    public GrantTarget {
        Objects.requireNonNull(type, "type");
        if ((type == Type.MEMBER || type == Type.ROLE) && (id == null || id.isBlank())) {
            throw new IllegalArgumentException(type + " target requires an id");
        }
    }

    public static GrantTarget everyone() { return new GrantTarget(Type.EVERYONE, null); }

    public static GrantTarget self() { return new GrantTarget(Type.SELF, null); }

    public static GrantTarget member(String userId) { return new GrantTarget(Type.MEMBER, userId); }

    public static GrantTarget role(String roleId) { return new GrantTarget(Type.ROLE, roleId); }
}
