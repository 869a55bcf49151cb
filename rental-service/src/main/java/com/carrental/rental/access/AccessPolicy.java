package com.carrental.rental.access;

import com.carrental.rental.enums.RentalAction;
import com.carrental.rental.enums.UserRole;
import com.carrental.rental.exception.AccessDeniedException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Role to permitted-action table.
 */
public final class AccessPolicy {

    private static final Map<UserRole, Set<RentalAction>> PERMISSIONS = new EnumMap<>(UserRole.class);

    static {
        Set<RentalAction> customer = EnumSet.of(
                RentalAction.SEARCH_AVAILABILITY,
                RentalAction.VIEW_FLEET,
                RentalAction.CREATE_BOOKING,
                RentalAction.VIEW_OWN_BOOKINGS);

        Set<RentalAction> admin = EnumSet.copyOf(customer);
        admin.addAll(EnumSet.of(
                RentalAction.CREATE_BOOKING_ON_BEHALF,
                RentalAction.VIEW_ALL_BOOKINGS,
                RentalAction.APPROVE_BOOKING,
                RentalAction.REJECT_BOOKING,
                RentalAction.ADD_CHARGE,
                RentalAction.MANAGE_FLEET,
                RentalAction.MANAGE_MAINTENANCE));

        PERMISSIONS.put(UserRole.CUSTOMER, Collections.unmodifiableSet(customer));
        PERMISSIONS.put(UserRole.ADMIN, Collections.unmodifiableSet(admin));
    }

    private AccessPolicy() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean permits(UserRole role, RentalAction action) {
        if (role == null || action == null) {
            return false;
        }
        return permissionsOf(role).contains(action);
    }

    public static void require(Actor actor, RentalAction action) {
        if (actor == null || !permits(actor.role(), action)) {
            throw new AccessDeniedException(describe(actor) + " may not perform " + action);
        }
    }

    /**
     * Lets the owner through with {@code ownAction}; anyone else needs {@code otherAction}.
     */
    public static void requireOwnerOr(Actor actor, Long ownerId, RentalAction ownAction, RentalAction otherAction) {
        if (actor != null && actor.isSelf(ownerId)) {
            require(actor, ownAction);
            return;
        }
        require(actor, otherAction);
    }

    public static Set<RentalAction> permissionsOf(UserRole role) {
        return PERMISSIONS.getOrDefault(role, Set.of());
    }

    private static String describe(Actor actor) {
        if (actor == null) {
            return "Anonymous caller";
        }
        return "User " + actor.userId() + " (" + actor.role() + ")";
    }
}
