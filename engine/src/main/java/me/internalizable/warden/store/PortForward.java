package me.internalizable.warden.store;

import me.internalizable.warden.api.WardenAPI;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * An active host-port to instance-port forward (TCP and UDP).
 *
 * @param instanceId target instance
 * @param internalPort port inside the instance
 * @param hostPort port listened on by the host, unique across all users
 */
public record PortForward(@Nonnull String instanceId, int internalPort, int hostPort)
        implements WardenAPI.PortForwardInfo {

    public PortForward {
        Objects.requireNonNull(instanceId, "instanceId");
    }

    @Override
    @Nonnull
    public String getInstanceId() {
        return instanceId;
    }

    @Override
    public int getInternalPort() {
        return internalPort;
    }

    @Override
    public int getHostPort() {
        return hostPort;
    }
}
