package io.suitediscovery.core.suite;

/**
 * Marker interface for discoverable test suites.
 *
 * <p>Every class that should be picked up by discovery implements this
 * interface, directly or through a superclass. Abstract implementors are
 * recognised as suite types but are never returned by discovery.
 */
public interface Suite {
}
