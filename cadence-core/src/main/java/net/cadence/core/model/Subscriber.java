package net.cadence.core.model;

public record Subscriber(
        String username,
        String fullName,     // null = not provided
        String email
) {
    /** Mail address with display name; full name is preferred over the username. */
    public String address() {
        String display = (fullName != null && !fullName.isBlank()) ? fullName : username;
        return "\"" + display + "\" <" + email + ">";
    }
}
