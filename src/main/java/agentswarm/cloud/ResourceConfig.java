package agentswarm.cloud;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Creation parameters for a worker resource.
 * {@code autoDestroy} and {@code idleStopTimeout} are advisory hints to the platform;
 * the reaper does not depend on them.
 */
public final class ResourceConfig {
    private final String image;
    private final boolean autoDestroy;
    private final Duration stopTimeout;
    private final String stopSignal;
    private final Duration idleStopTimeout;
    private final String cpuKind;
    private final int cpus;
    private final int memoryMb;
    private final Map<String, String> env;

    private ResourceConfig(Builder builder) {
        this.image = Objects.requireNonNull(builder.image, "image is required");
        this.autoDestroy = builder.autoDestroy;
        this.stopTimeout = builder.stopTimeout;
        this.stopSignal = builder.stopSignal;
        this.idleStopTimeout = builder.idleStopTimeout;
        this.cpuKind = builder.cpuKind;
        this.cpus = builder.cpus;
        this.memoryMb = builder.memoryMb;
        this.env = Map.copyOf(builder.env);
    }

    public String image() {
        return image;
    }

    public boolean autoDestroy() {
        return autoDestroy;
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    public String stopSignal() {
        return stopSignal;
    }

    public Duration idleStopTimeout() {
        return idleStopTimeout;
    }

    public String cpuKind() {
        return cpuKind;
    }

    public int cpus() {
        return cpus;
    }

    public int memoryMb() {
        return memoryMb;
    }

    public Map<String, String> env() {
        return env;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String image;
        private boolean autoDestroy = true;
        private Duration stopTimeout = Duration.ofSeconds(30);
        private String stopSignal = "SIGTERM";
        private Duration idleStopTimeout = Duration.ofMinutes(10);
        private String cpuKind = "shared";
        private int cpus = 1;
        private int memoryMb = 1024;
        private final Map<String, String> env = new LinkedHashMap<>();

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder autoDestroy(boolean autoDestroy) {
            this.autoDestroy = autoDestroy;
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public Builder stopSignal(String stopSignal) {
            this.stopSignal = stopSignal;
            return this;
        }

        public Builder idleStopTimeout(Duration idleStopTimeout) {
            this.idleStopTimeout = idleStopTimeout;
            return this;
        }

        public Builder guest(String cpuKind, int cpus, int memoryMb) {
            this.cpuKind = cpuKind;
            this.cpus = cpus;
            this.memoryMb = memoryMb;
            return this;
        }

        public Builder env(String name, String value) {
            if (value != null) {
                this.env.put(name, value);
            }
            return this;
        }

        public Builder env(Map<String, String> values) {
            values.forEach(this::env);
            return this;
        }

        public ResourceConfig build() {
            return new ResourceConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ResourceConfig{image='" + image + "', autoDestroy=" + autoDestroy
                + ", guest=" + cpuKind + "/" + cpus + "cpu/" + memoryMb + "mb}";
    }
}
