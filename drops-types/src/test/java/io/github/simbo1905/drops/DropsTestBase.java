package io.github.simbo1905.drops;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import static io.github.simbo1905.drops.DropsLogging.LOG;

/// Base class for all type tests.
/// - Emits an INFO banner per test.
/// - Shares the symbols most tests declare keys with.
class DropsTestBase extends DropsLoggingConfig {

    static final Symbol A = Symbol.of("a");
    static final Symbol B = Symbol.of("b");
    static final Symbol NAME = Symbol.of("name");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static Result.Err kindFailure(Object input, Kind kind) {
        return Result.err(new Failure.ConstraintFailure(
            input, StandardPredicates.TYPE, java.util.Arrays.asList(kind, input)));
    }
}
