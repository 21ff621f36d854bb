package me.internalizable.warden.api;

import javax.annotation.Nullable;

/**
 * Builder implementation for resize options.
 */
public class ResizeOptionsBuilder implements WardenAPI.ResizeOptions.Builder {

    private final boolean delta;
    private Integer ramGb;
    private Integer cpuCores;
    private Integer diskGb;

    ResizeOptionsBuilder(boolean delta) {
        this.delta = delta;
    }

    @Override
    public WardenAPI.ResizeOptions.Builder ramGb(int ramGb) {
        this.ramGb = ramGb;
        return this;
    }

    @Override
    public WardenAPI.ResizeOptions.Builder cpuCores(int cpuCores) {
        this.cpuCores = cpuCores;
        return this;
    }

    @Override
    public WardenAPI.ResizeOptions.Builder diskGb(int diskGb) {
        this.diskGb = diskGb;
        return this;
    }

    @Override
    public WardenAPI.ResizeOptions build() {
        return new ResizeOptionsImpl(delta, ramGb, cpuCores, diskGb);
    }

    private record ResizeOptionsImpl(
            boolean delta,
            Integer ramGb,
            Integer cpuCores,
            Integer diskGb
    ) implements WardenAPI.ResizeOptions {

        @Override
        public boolean isDelta() {
            return delta;
        }

        @Override
        @Nullable
        public Integer getRamGb() {
            return ramGb;
        }

        @Override
        @Nullable
        public Integer getCpuCores() {
            return cpuCores;
        }

        @Override
        @Nullable
        public Integer getDiskGb() {
            return diskGb;
        }
    }
}
