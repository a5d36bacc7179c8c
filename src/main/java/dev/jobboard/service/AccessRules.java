package dev.jobboard.service;

import dev.jobboard.entity.Job;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ForbiddenException;

import java.util.Arrays;

/**
 * Role and ownership checks shared by the services. Admins pass every check except
 * {@link #requireExactRole}, which guards actions that only make sense for one kind of account.
 */
final class AccessRules {

    private AccessRules() {
    }

    /**
     * @param action completes the sentence "Only ... can {action}", e.g. "post jobs"
     */
    static void requireRole(User actor, String action, Role... allowed) {
        if (actor.isAdmin() || Arrays.asList(allowed).contains(actor.getRole())) {
            return;
        }
        throw new ForbiddenException("Only " + describe(allowed) + " can " + action);
    }

    /**
     * Like {@link #requireRole} without the admin pass, for actions tied to the account's own
     * role such as applying to a job.
     */
    static void requireExactRole(User actor, String action, Role role) {
        if (actor.getRole() != role) {
            throw new ForbiddenException("Only " + describe(role) + " can " + action);
        }
    }

    static void requireOwnerOrAdmin(Job job, User actor, String action) {
        if (!actor.isAdmin() && !job.isOwnedBy(actor)) {
            throw new ForbiddenException("Not authorized to " + action);
        }
    }

    private static String describe(Role... roles) {
        return String.join(" or ", Arrays.stream(roles)
                .map(role -> role.value().replace('_', ' ') + "s")
                .toList());
    }
}
