package io.synclane.sync;

@FunctionalInterface
public interface ConnectivityProbe {
    boolean isReachable(String remoteUrl);
}
