package io.suitediscovery.core.suite;

import java.lang.annotation.Annotation;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable handle to a discoverable suite class.
 *
 * <p>Two descriptors are equal when they wrap the same class. Descriptors are
 * created by the loading step of discovery and never change afterwards.
 */
public final class SuiteDescriptor {

    /** Orders descriptors by fully-qualified name, ascending. */
    public static final Comparator<SuiteDescriptor> BY_NAME = Comparator.comparing(SuiteDescriptor::name);

    private final Class<? extends Suite> type;
    private final Set<String> tags;

    private SuiteDescriptor(Class<? extends Suite> type) {
        this.type = type;
        this.tags = readTags(type);
    }

    /**
     * Creates a descriptor for the given suite class.
     */
    public static SuiteDescriptor of(Class<? extends Suite> type) {
        return new SuiteDescriptor(Objects.requireNonNull(type, "type"));
    }

    /**
     * Creates a descriptor for a class loaded by name.
     *
     * @throws IllegalArgumentException if the class is not a suite type
     */
    public static SuiteDescriptor fromClass(Class<?> type) {
        if (!isSuiteType(type)) {
            throw new IllegalArgumentException(type.getName() + " does not implement " + Suite.class.getName());
        }
        return new SuiteDescriptor(type.asSubclass(Suite.class));
    }

    /**
     * Returns {@code true} if the class satisfies the {@link Suite} marker contract.
     */
    public static boolean isSuiteType(Class<?> type) {
        return type != null && Suite.class.isAssignableFrom(type);
    }

    public Class<? extends Suite> type() { return type; }

    /** Fully-qualified class name; unique per descriptor. */
    public String name() { return type.getName(); }

    public String simpleName() { return type.getSimpleName(); }

    public String packageName() { return type.getPackageName(); }

    /** {@code true} for abstract classes and interfaces, which cannot be instantiated. */
    public boolean isAbstract() {
        return Modifier.isAbstract(type.getModifiers());
    }

    public Visibility visibility() {
        return Visibility.fromModifiers(type.getModifiers());
    }

    public Set<String> tags() { return tags; }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public boolean isAnnotated(Class<? extends Annotation> annotation) {
        return type.isAnnotationPresent(annotation);
    }

    /**
     * Returns {@code true} if this suite lives in {@code pkg} or one of its sub-packages.
     */
    public boolean isInPackage(String pkg) {
        String own = packageName();
        return own.equals(pkg) || own.startsWith(pkg + ".");
    }

    private static Set<String> readTags(Class<? extends Suite> type) {
        SuiteTags annotation = type.getAnnotation(SuiteTags.class);
        if (annotation == null) {
            return Set.of();
        }
        return Set.copyOf(Arrays.asList(annotation.value()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SuiteDescriptor)) return false;
        return type.equals(((SuiteDescriptor) o).type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return name();
    }
}
