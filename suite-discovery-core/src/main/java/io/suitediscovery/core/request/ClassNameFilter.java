package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Keeps suites whose fully-qualified name matches a regular expression, e.g.
 * {@code ".*IntegrationSuite"}.
 *
 * <p>Equality is on the regex source.
 */
public final class ClassNameFilter implements DiscoveryFilter {

    private final String regex;
    private final Pattern pattern;

    public ClassNameFilter(String regex) {
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("regex must not be null or empty");
        }
        try {
            this.pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid class name pattern: " + regex, e);
        }
        this.regex = regex;
    }

    public String regex() {
        return regex;
    }

    @Override
    public boolean test(SuiteDescriptor suite) {
        return pattern.matcher(suite.name()).matches();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassNameFilter)) return false;
        return regex.equals(((ClassNameFilter) o).regex);
    }

    @Override
    public int hashCode() {
        return regex.hashCode();
    }

    @Override
    public String toString() {
        return "ClassNameFilter[regex=" + regex + "]";
    }
}
