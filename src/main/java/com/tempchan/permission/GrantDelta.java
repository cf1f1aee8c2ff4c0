package com.tempchan.permission;

import java.util.List;

/**
 * Change to the overrides of an existing channel: grants to put (replacing any
 * override for the same target) and targets whose override is removed.
 */
public record GrantDelta(List<Grant> put, List<GrantTarget> remove) {

    private static final GrantDelta NONE = new GrantDelta(List.of(), List.of());

    public GrantDelta {
        put = List.copyOf(put);
        remove = List.copyOf(remove);
    }

    public static GrantDelta none() { return NONE; }

    public static GrantDelta put(Grant grant) { return new GrantDelta(List.of(grant), List.of()); }

    public static GrantDelta remove(GrantTarget target) { return new GrantDelta(List.of(), List.of(target)); }

    public boolean isEmpty() {
        return put.isEmpty() && remove.isEmpty();
    }
}
