package io.suitediscovery.core.fixtures.broken;

import io.suitediscovery.core.suite.Suite;

public class FailingInitSuite implements Suite {

    static {
        if (Boolean.parseBoolean("true")) {
            throw new IllegalStateException("boom");
        }
    }
}
