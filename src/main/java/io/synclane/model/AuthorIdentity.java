package io.synclane.model;

public record AuthorIdentity(String name, String email) {
    public AuthorIdentity {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("author name is required");
        }
        email = email == null ? "" : email.trim();
    }
}
