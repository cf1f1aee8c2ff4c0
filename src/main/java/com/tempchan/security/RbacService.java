package com.tempchan.security;

import com.tempchan.config.TempchanProperties;
import org.springframework.stereotype.Service;

import java.util.Set;

@Service
public class RbacService {

    private final Set<String> configuredAdmins;

    public RbacService(TempchanProperties properties) {
        this.configuredAdmins = Set.copyOf(properties.getSecurity().getAdminUserIds());
    }

    public boolean isAdmin(Requester requester) {
        return requester.platformAdmin() || configuredAdmins.contains(requester.userId());
    }

    public boolean isOwnerOrAdmin(Requester requester, String ownerId) {
        return ownerId.equals(requester.userId()) || isAdmin(requester);
    }
}
