package com.tempchan.permission;

import java.util.List;
import java.util.Optional;

/**
 * Full set of permission overrides a channel is created with. At most one
 * grant per target.
 */
public record GrantSet(List<Grant> grants) {

    public GrantSet {
        grants = List.copyOf(grants);
    }

    public Optional<Grant> forTarget(GrantTarget target) {
        return grants.stream().filter(g -> g.target().equals(target)).findFirst();
    }
}
