package com.tempchan.permission;

import com.tempchan.lifecycle.ChannelDescriptor;
import com.tempchan.lifecycle.Visibility;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.tempchan.permission.Permission.MANAGE_CHANNEL;
import static com.tempchan.permission.Permission.MANAGE_MESSAGES;
import static com.tempchan.permission.Permission.SEND;
import static com.tempchan.permission.Permission.VIEW;

/**
 * Computes permission overrides for temp channels. Pure: reads only its
 * arguments and never talks to the platform.
 */
@Component
public class PermissionPlanner {

    /**
     * Category overrides are inherited first; the everyone, owner and bot
     * overrides replace any inherited override for the same target.
     */
    public GrantSet planCreate(Visibility visibility, String ownerId, List<Grant> categoryDefaults) {
        return planCreate(visibility, ownerId, categoryDefaults, Set.of());
    }

    public GrantSet planCreate(Visibility visibility, String ownerId,
                               List<Grant> categoryDefaults, Set<String> invited) {
        Map<GrantTarget, Grant> grants = new LinkedHashMap<>();
        if (categoryDefaults != null) {
            categoryDefaults.forEach(g -> grants.put(g.target(), g));
        }

        GrantTarget everyone = GrantTarget.everyone();
        grants.put(everyone, visibility == Visibility.PUBLIC
                ? Grant.allow(everyone, VIEW)
                : Grant.deny(everyone, VIEW));

        GrantTarget owner = GrantTarget.member(ownerId);
        grants.put(owner, Grant.allow(owner, VIEW, SEND, MANAGE_MESSAGES));

        GrantTarget self = GrantTarget.self();
        grants.put(self, Grant.allow(self, VIEW, SEND, MANAGE_MESSAGES, MANAGE_CHANNEL));

        if (visibility == Visibility.PRIVATE) {
            for (String userId : invited) {
                if (userId.equals(ownerId)) continue;
                GrantTarget member = GrantTarget.member(userId);
                grants.put(member, memberAccess(member));
            }
        }
        return new GrantSet(List.copyOf(grants.values()));
    }

    /** Empty delta when the user already has access. */
    public GrantDelta planInvite(ChannelDescriptor descriptor, String userId) {
        if (descriptor.isMember(userId)) {
            return GrantDelta.none();
        }
        return GrantDelta.put(memberAccess(GrantTarget.member(userId)));
    }

    /** Empty delta when the user has no explicit access. The owner is never planned out. */
    public GrantDelta planKick(ChannelDescriptor descriptor, String userId) {
        if (!descriptor.isInvited(userId) || descriptor.ownerId().equals(userId)) {
            return GrantDelta.none();
        }
        return GrantDelta.remove(GrantTarget.member(userId));
    }

    private Grant memberAccess(GrantTarget member) {
        return Grant.allow(member, VIEW, SEND);
    }
}
