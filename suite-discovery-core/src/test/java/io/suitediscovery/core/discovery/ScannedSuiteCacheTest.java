package io.suitediscovery.core.discovery;

import io.suitediscovery.core.fixtures.*;
import io.suitediscovery.core.suite.SuiteDescriptor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class ScannedSuiteCacheTest {

    private final RecordingSuiteLoader loader = new RecordingSuiteLoader();

    @Test
    void scansOnceAndKeepsTheResult() {
        FakeSuiteScanner scanner = FakeSuiteScanner.of(AlphaSuite.class, BetaSuite.class);
        ScannedSuiteCache cache = new ScannedSuiteCache(scanner, loader);

        List<SuiteDescriptor> first = cache.get();
        List<SuiteDescriptor> second = cache.get();

        assertSame(first, second);
        assertEquals(1, scanner.calls());
        assertEquals(1, cache.scanCount());
    }

    @Test
    void keepsAbstractSuiteTypesAndDropsNonSuites() {
        FakeSuiteScanner scanner = FakeSuiteScanner.ofNames(
                AbstractBaseSuite.class.getName(),
                AlphaSuite.class.getName(),
                InitTracker.class.getName());

        List<SuiteDescriptor> suites = new ScannedSuiteCache(scanner, loader).get();

        assertEquals(List.of(SuiteDescriptor.of(AbstractBaseSuite.class), SuiteDescriptor.of(AlphaSuite.class)),
                suites);
    }

    @Test
    void loadsScannedClassesWithInitialization() {
        new ScannedSuiteCache(FakeSuiteScanner.of(AlphaSuite.class), loader).get();

        assertEquals(List.of(AlphaSuite.class.getName() + ":true"), loader.calls());
    }

    @Test
    void loadFailureIsFatal() {
        ScannedSuiteCache cache = new ScannedSuiteCache(FakeSuiteScanner.ofNames("com.example.Gone"), loader);

        SuiteLoadException e = assertThrows(SuiteLoadException.class, cache::get);
        assertEquals("com.example.Gone", e.className());
    }

    @Test
    void failedScanIsNotRemembered() {
        FakeSuiteScanner scanner = FakeSuiteScanner.failing();
        ScannedSuiteCache cache = new ScannedSuiteCache(scanner, loader);

        assertThrows(SuiteScanException.class, cache::get);
        assertThrows(SuiteScanException.class, cache::get);
        assertEquals(2, scanner.calls());
    }

    @Test
    void concurrentFirstUseScansOnce() throws Exception {
        FakeSuiteScanner scanner = FakeSuiteScanner.of(AlphaSuite.class, GammaSuite.class);
        ScannedSuiteCache cache = new ScannedSuiteCache(scanner, loader);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<SuiteDescriptor>>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.get();
                }));
            }
            start.countDown();
            for (Future<List<SuiteDescriptor>> future : futures) {
                assertEquals(2, future.get(10, TimeUnit.SECONDS).size());
            }
            assertEquals(1, scanner.calls());
        } finally {
            pool.shutdownNow();
        }
    }
}
