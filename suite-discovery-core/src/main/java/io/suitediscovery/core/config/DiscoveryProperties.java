package io.suitediscovery.core.config;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Names of the system properties that tune discovery, and the lookup used to read them.
 *
 * <p>Each property can also be supplied as an environment variable: upper-case,
 * with dots replaced by underscores (e.g. {@code SUITEDISCOVERY_DISCOVERY_JAR_SCAN_DISABLE}).
 */
public final class DiscoveryProperties {

    /** When {@code "true"}, jar files on the classpath are not scanned for suites. */
    public static final String DISABLE_JAR_DISCOVERY = "suitediscovery.discovery.jar.scan.disable";

    /** When {@code "false"}, jars nested inside other jars are scanned as well. */
    public static final String DISABLE_NESTED_JAR_SCANNING = "suitediscovery.discovery.nested.jar.scan.disable";

    private DiscoveryProperties() {
        // utility class
    }

    /**
     * Reads {@code name} from system properties, falling back to the environment.
     *
     * @return the value, or {@code null} if neither source defines it
     */
    public static String syspropOrEnv(String name) {
        return syspropOrEnv(name, System::getProperty, System::getenv);
    }

    static String syspropOrEnv(String name, UnaryOperator<String> sysprops, UnaryOperator<String> env) {
        String value = sysprops.apply(name);
        if (value != null) {
            return value;
        }
        return env.apply(toEnvName(name));
    }

    static String toEnvName(String name) {
        return name.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    /**
     * Reads a boolean flag, returning {@code defaultValue} when it is not set.
     */
    public static boolean flag(String name, boolean defaultValue) {
        String value = syspropOrEnv(name);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
