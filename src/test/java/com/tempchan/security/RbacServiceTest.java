package com.tempchan.security;

import com.tempchan.config.TempchanProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RbacServiceTest {

    private final RbacService rbacService = rbacWithAdmins("admin-1");

    private static RbacService rbacWithAdmins(String... ids) {
        TempchanProperties properties = new TempchanProperties();
        properties.getSecurity().setAdminUserIds(List.of(ids));
        return new RbacService(properties);
    }

    @Test
    void configuredAdminIsAdmin() {
        assertTrue(rbacService.isAdmin(new Requester("admin-1", "g1")));
    }

    @Test
    void platformAdministratorIsAdmin() {
        assertTrue(rbacService.isAdmin(new Requester("u1", "U1", "g1", true)));
    }

    @Test
    void regularUserIsNotAdmin() {
        assertFalse(rbacService.isAdmin(new Requester("u1", "g1")));
    }

    @Test
    void ownerOrAdminCheck() {
        assertTrue(rbacService.isOwnerOrAdmin(new Requester("u1", "g1"), "u1"));
        assertTrue(rbacService.isOwnerOrAdmin(new Requester("admin-1", "g1"), "u1"));
        assertFalse(rbacService.isOwnerOrAdmin(new Requester("u2", "g1"), "u1"));
    }
}
