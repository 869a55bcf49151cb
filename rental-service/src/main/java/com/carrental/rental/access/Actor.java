package com.carrental.rental.access;

import com.carrental.rental.enums.UserRole;

/**
 * The authenticated caller of an operation, passed explicitly into every service call.
 */
public record Actor(Long userId, UserRole role) {

    public static Actor admin(Long userId) {
        return new Actor(userId, UserRole.ADMIN);
    }

    public static Actor customer(Long userId) {
        return new Actor(userId, UserRole.CUSTOMER);
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isSelf(Long otherUserId) {
        return userId != null && userId.equals(otherUserId);
    }
}
