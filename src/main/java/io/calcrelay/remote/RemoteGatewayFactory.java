package io.calcrelay.remote;

import io.calcrelay.model.ClientRow;

@FunctionalInterface
public interface RemoteGatewayFactory {
    RemoteGateway create(ClientRow client);

    /**
     * {@link LocalGateway} for {@code local:} URLs, {@link FirecrestGateway} otherwise.
     */
    static RemoteGatewayFactory byScheme(long requestTimeoutMs) {
        return client -> LocalGateway.handles(client.clientUrl())
                ? new LocalGateway(client)
                : new FirecrestGateway(client, requestTimeoutMs);
    }
}
