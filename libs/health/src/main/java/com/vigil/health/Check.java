package com.vigil.health;

/**
 * Identity and static metadata of a health check.
 *
 * @param id           unique check id (e.g., "postgres-connectivity")
 * @param description  human-readable description of what the check verifies
 * @param yellowImpact impact on the service when the check is YELLOW (optional)
 * @param redImpact    impact on the service when the check is RED
 */
public record Check(String id, String description, String yellowImpact, String redImpact) {

    public Check {
        requireText(id, "id");
        requireText(description, "description");
        requireText(redImpact, "redImpact");
        if (yellowImpact != null && yellowImpact.isBlank()) {
            yellowImpact = null;
        }
    }

    /** Creates a check without a yellow impact statement. */
    public static Check of(String id, String description, String redImpact) {
        return new Check(id, description, null, redImpact);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
