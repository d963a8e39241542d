package com.jreinhal.caseflow.filter;

import com.jreinhal.caseflow.model.User;

/**
 * Thread-local caller identity for the current request.
 *
 * Populated by {@link TenantFilter} and cleared when the request completes.
 */
public class SecurityContext {

    private static final ThreadLocal<User> currentUser = new ThreadLocal<>();

    /**
     * Set the current user for this request thread.
     */
    public static void setCurrentUser(User user) {
        currentUser.set(user);
    }

    /**
     * Get the current caller.
     *
     * @return The user, or null if not authenticated
     */
    public static User getCurrentUser() {
        return currentUser.get();
    }

    public static boolean isAuthenticated() {
        return currentUser.get() != null;
    }

    /**
     * Get the current user's ID for logging purposes.
     */
    public static String getCurrentUserId() {
        User user = currentUser.get();
        return user != null ? user.getId() : "ANONYMOUS";
    }

    /**
     * Clear the current user context (called at end of request).
     */
    public static void clear() {
        currentUser.remove();
    }
}
