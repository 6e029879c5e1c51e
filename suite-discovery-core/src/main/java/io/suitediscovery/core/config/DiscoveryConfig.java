package io.suitediscovery.core.config;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for suite discovery.
 * Immutable value object, use the {@link Builder} to construct.
 */
public final class DiscoveryConfig {

    private final boolean disableNestedJarScanning;
    private final boolean disableJarScanning;
    private final List<String> acceptPackages;
    private final List<String> rejectPackages;
    private final ClassLoader classLoader;

    private DiscoveryConfig(Builder builder) {
        this.disableNestedJarScanning = builder.disableNestedJarScanning;
        this.disableJarScanning = builder.disableJarScanning;
        this.acceptPackages = List.copyOf(builder.acceptPackages);
        this.rejectPackages = List.copyOf(builder.rejectPackages);
        this.classLoader = builder.classLoader;
    }

    /** Skip jars nested inside other jars, and module-path scanning. */
    public boolean disableNestedJarScanning() { return disableNestedJarScanning; }
    /**
     * Scan classpath directories only. The {@link DiscoveryProperties#DISABLE_JAR_DISCOVERY}
     * flag, read at scan time, also enables this.
     */
    public boolean disableJarScanning() { return disableJarScanning; }
    /** Packages to restrict the scan to; empty scans everything. */
    public List<String> acceptPackages() { return acceptPackages; }
    /** Packages rejected in addition to the built-in infrastructure packages. */
    public List<String> rejectPackages() { return rejectPackages; }
    /** Class loader suites are loaded through. */
    public ClassLoader classLoader() { return classLoader; }

    /** Creates a builder with sensible defaults, honouring the {@link DiscoveryProperties} flags. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean disableNestedJarScanning =
                DiscoveryProperties.flag(DiscoveryProperties.DISABLE_NESTED_JAR_SCANNING, true);
        private boolean disableJarScanning = false;
        private List<String> acceptPackages = List.of();
        private List<String> rejectPackages = List.of();
        private ClassLoader classLoader = DiscoveryConfig.class.getClassLoader();

        public Builder disableNestedJarScanning(boolean v) { this.disableNestedJarScanning = v; return this; }
        public Builder disableJarScanning(boolean v) { this.disableJarScanning = v; return this; }
        public Builder acceptPackages(List<String> v) { this.acceptPackages = validatePackages(v); return this; }
        public Builder rejectPackages(List<String> v) { this.rejectPackages = validatePackages(v); return this; }
        public Builder classLoader(ClassLoader v) {
            this.classLoader = Objects.requireNonNull(v, "classLoader");
            return this;
        }

        private static List<String> validatePackages(List<String> packages) {
            for (String pkg : packages) {
                if (pkg == null || pkg.isBlank()) {
                    throw new IllegalArgumentException("package names must not be null or blank");
                }
                if (pkg.startsWith(".") || pkg.endsWith(".")) {
                    throw new IllegalArgumentException("Malformed package name: " + pkg);
                }
            }
            return packages;
        }

        public DiscoveryConfig build() {
            return new DiscoveryConfig(this);
        }
    }
}
