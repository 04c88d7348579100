package io.synclane.model;

public record Credentials(String username, String password) {
    public static Credentials none() {
        return new Credentials("", "");
    }

    public boolean isPresent() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=***]";
    }
}
