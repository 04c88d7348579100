package io.synclane.model;

public record TransferFailure(String oid, TransferDirection direction, int attempts, String message) {
}
