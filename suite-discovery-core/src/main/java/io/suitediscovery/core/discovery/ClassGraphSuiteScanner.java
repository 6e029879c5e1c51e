package io.suitediscovery.core.discovery;

import io.github.classgraph.ClassGraph;
import io.github.classgraph.ClassGraphException;
import io.github.classgraph.ScanResult;
import io.suitediscovery.core.config.DiscoveryConfig;
import io.suitediscovery.core.config.DiscoveryProperties;
import io.suitediscovery.core.suite.Suite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link SuiteScanner} that uses ClassGraph to find every implementor of {@link Suite}
 * on the classpath.
 *
 * <p>Infrastructure packages (the JDK, Kotlin, JUnit, logging and ClassGraph itself)
 * are never scanned; they cannot contain suites and make up most of a typical
 * test classpath.
 */
public final class ClassGraphSuiteScanner implements SuiteScanner {

    private static final Logger log = LoggerFactory.getLogger(ClassGraphSuiteScanner.class);

    static final List<String> REJECTED_PACKAGES = List.of(
            "java",
            "javax",
            "jdk",
            "sun",
            "com.sun",
            "kotlin",
            "kotlinx",
            "androidx",
            "org.jetbrains.kotlin",
            "org.junit",
            "org.opentest4j",
            "org.apiguardian",
            "org.slf4j",
            "io.github.classgraph",
            "nonapi.io.github.classgraph"
    );

    private final DiscoveryConfig config;

    public ClassGraphSuiteScanner(DiscoveryConfig config) {
        this.config = config;
    }

    @Override
    public List<String> scan() {
        long start = System.currentTimeMillis();
        try (ScanResult scanResult = classGraph().scan()) {
            List<String> names = scanResult.getClassesImplementing(Suite.class.getName()).getNames();
            log.info("[scan] Completed classgraph scan in {}ms, found {} candidate suites",
                    System.currentTimeMillis() - start, names.size());
            return names;
        } catch (ClassGraphException e) {
            throw new SuiteScanException("Classpath scan for suites failed", e);
        }
    }

    ClassGraph classGraph() {
        ClassGraph cg = new ClassGraph()
                .enableClassInfo()
                .enableExternalClasses()
                .ignoreClassVisibility()
                .addClassLoader(config.classLoader());

        if (!config.acceptPackages().isEmpty()) {
            cg.acceptPackages(config.acceptPackages().toArray(new String[0]));
        }

        List<String> rejected = new ArrayList<>(REJECTED_PACKAGES);
        rejected.addAll(config.rejectPackages());
        cg.rejectPackages(rejected.toArray(new String[0]));

        if (config.disableNestedJarScanning()) {
            log.debug("[scan] Nested jar scanning is disabled");
            cg.disableNestedJarScanning();
            cg.disableModuleScanning();
        }
        if (config.disableJarScanning()
                || DiscoveryProperties.flag(DiscoveryProperties.DISABLE_JAR_DISCOVERY, false)) {
            log.debug("[scan] Jar scanning is disabled");
            cg.disableJarScanning();
        }
        return cg;
    }
}
