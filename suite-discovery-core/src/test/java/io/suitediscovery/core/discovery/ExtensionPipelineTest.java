package io.suitediscovery.core.discovery;

import io.suitediscovery.core.fixtures.AlphaSuite;
import io.suitediscovery.core.fixtures.BetaSuite;
import io.suitediscovery.core.fixtures.GammaSuite;
import io.suitediscovery.core.suite.SuiteDescriptor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExtensionPipelineTest {

    private final SuiteDescriptor alpha = SuiteDescriptor.of(AlphaSuite.class);
    private final SuiteDescriptor beta = SuiteDescriptor.of(BetaSuite.class);
    private final SuiteDescriptor gamma = SuiteDescriptor.of(GammaSuite.class);

    @Test
    void noExtensionsReturnsInputUnchanged() {
        List<SuiteDescriptor> input = List.of(gamma, alpha);

        assertEquals(input, new ExtensionPipeline(List.of()).apply(input));
    }

    @Test
    void eachExtensionReceivesThePreviousOutput() {
        DiscoveryExtension reverse = suites -> {
            List<SuiteDescriptor> out = new ArrayList<>(suites);
            Collections.reverse(out);
            return out;
        };
        DiscoveryExtension dropFirst = suites -> suites.subList(1, suites.size());

        List<SuiteDescriptor> result = new ExtensionPipeline(List.of(reverse, dropFirst))
                .apply(List.of(alpha, beta, gamma));

        assertEquals(List.of(beta, alpha), result);
    }

    @Test
    void orderOfExtensionsMatters() {
        DiscoveryExtension reverse = suites -> {
            List<SuiteDescriptor> out = new ArrayList<>(suites);
            Collections.reverse(out);
            return out;
        };
        DiscoveryExtension dropFirst = suites -> suites.subList(1, suites.size());

        List<SuiteDescriptor> result = new ExtensionPipeline(List.of(dropFirst, reverse))
                .apply(List.of(alpha, beta, gamma));

        assertEquals(List.of(gamma, beta), result);
    }

    @Test
    void extensionFailurePropagates() {
        DiscoveryExtension failing = suites -> {
            throw new IllegalStateException("nope");
        };

        assertThrows(IllegalStateException.class,
                () -> new ExtensionPipeline(List.of(failing)).apply(List.of(alpha)));
    }

    @Test
    void defaultNameIsTheClassName() {
        assertEquals("NamedExtension", new NamedExtension().name());
    }

    private static final class NamedExtension implements DiscoveryExtension {
        @Override
        public List<SuiteDescriptor> afterScan(List<SuiteDescriptor> suites) {
            return suites;
        }
    }
}
