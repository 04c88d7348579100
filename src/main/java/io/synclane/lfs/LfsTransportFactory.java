package io.synclane.lfs;

import io.synclane.config.SyncSettings;
import io.synclane.model.Credentials;

/**
 * Creates the transport for a remote; may return {@code null} when the remote has no large-object endpoint.
 */
@FunctionalInterface
public interface LfsTransportFactory {
    LfsTransport create(String remoteUrl, Credentials credentials);

    static LfsTransportFactory http(SyncSettings settings) {
        return (remoteUrl, credentials) -> HttpLfsTransport.forRemote(remoteUrl, credentials, settings);
    }
}
