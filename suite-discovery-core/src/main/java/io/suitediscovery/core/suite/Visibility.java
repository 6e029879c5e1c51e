package io.suitediscovery.core.suite;

import java.lang.reflect.Modifier;

/**
 * Java access level of a suite class.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PACKAGE_PRIVATE,
    PRIVATE;

    /**
     * Derives the visibility from a {@link Class#getModifiers()} bit set.
     */
    public static Visibility fromModifiers(int modifiers) {
        if (Modifier.isPublic(modifiers)) {
            return PUBLIC;
        }
        if (Modifier.isProtected(modifiers)) {
            return PROTECTED;
        }
        if (Modifier.isPrivate(modifiers)) {
            return PRIVATE;
        }
        return PACKAGE_PRIVATE;
    }
}
