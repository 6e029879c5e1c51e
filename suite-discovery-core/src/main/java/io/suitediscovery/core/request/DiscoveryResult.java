package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;

import java.util.List;

/**
 * Outcome of a discovery request.
 *
 * <p>{@code error} is set when discovery itself could not complete; the suite
 * and script lists are then empty. An empty suite list without an error means
 * nothing matched the request.
 *
 * @param suites  discovered suites, sorted by fully-qualified name
 * @param scripts script-style test sources; always empty, script discovery is not supported
 * @param error   the failure that aborted discovery, or {@code null}
 */
public record DiscoveryResult(List<SuiteDescriptor> suites, List<Class<?>> scripts, Throwable error) {

    public DiscoveryResult {
        suites = List.copyOf(suites);
        scripts = List.copyOf(scripts);
        if (error != null && (!suites.isEmpty() || !scripts.isEmpty())) {
            throw new IllegalArgumentException("A failed result must not carry suites or scripts");
        }
    }

    public static DiscoveryResult of(List<SuiteDescriptor> suites) {
        return new DiscoveryResult(suites, List.of(), null);
    }

    public static DiscoveryResult error(Throwable t) {
        return new DiscoveryResult(List.of(), List.of(), t);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
