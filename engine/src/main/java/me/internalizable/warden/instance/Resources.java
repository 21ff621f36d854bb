package me.internalizable.warden.instance;

import me.internalizable.warden.api.error.ValidationException;

import javax.annotation.Nonnull;

/**
 * Resource allotment of an instance. All values are positive.
 *
 * @param ramGb memory in GB
 * @param cpuCores CPU core count
 * @param diskGb root disk size in GB
 */
public record Resources(int ramGb, int cpuCores, int diskGb) {

    public Resources {
        if (ramGb <= 0 || cpuCores <= 0 || diskGb <= 0) {
            throw new ValidationException("Resources must be positive, got RAM=" + ramGb
                    + " CPU=" + cpuCores + " Disk=" + diskGb);
        }
    }

    /**
     * Render the human-readable config string cached on each instance.
     *
     * @return e.g. {@code 4GB RAM / 2 CPU / 10GB Disk}
     */
    @Nonnull
    public String describe() {
        return ramGb + "GB RAM / " + cpuCores + " CPU / " + diskGb + "GB Disk";
    }

    @Nonnull
    public Resources withRamGb(int ramGb) {
        return new Resources(ramGb, cpuCores, diskGb);
    }

    @Nonnull
    public Resources withCpuCores(int cpuCores) {
        return new Resources(ramGb, cpuCores, diskGb);
    }

    @Nonnull
    public Resources withDiskGb(int diskGb) {
        return new Resources(ramGb, cpuCores, diskGb);
    }
}
