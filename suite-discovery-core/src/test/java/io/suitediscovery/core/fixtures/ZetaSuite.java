package io.suitediscovery.core.fixtures;

import io.suitediscovery.core.suite.Suite;

public class ZetaSuite implements Suite {
}
