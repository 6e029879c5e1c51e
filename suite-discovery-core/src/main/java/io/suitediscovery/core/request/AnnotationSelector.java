package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;

import java.lang.annotation.Annotation;
import java.util.Objects;

/**
 * Selects suites whose class carries the given runtime-retained annotation.
 */
public record AnnotationSelector(Class<? extends Annotation> annotation) implements DiscoverySelector {

    public AnnotationSelector {
        Objects.requireNonNull(annotation, "annotation");
    }

    @Override
    public boolean test(SuiteDescriptor suite) {
        return suite.isAnnotated(annotation);
    }
}
