package org.cognita.junit.extensions.logging;

import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.cognita.junit.extensions.logging.LogLevel.ERROR;
import static org.cognita.junit.extensions.logging.LogLevel.WARN;

/**
 * Events and rules of one test must not leak into the next one.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class LogWatchExtensionIsolationTest {

    private static final Logger logger = LoggerFactory.getLogger(LogWatchExtensionIsolationTest.class);

    @Test
    @Order(1)
    @ExpectLog(level = ERROR, messagePattern = "first: expected error")
    void expectedErrorIsConsumed() {
        logger.info("first: ignored info");
        logger.error("first: expected error");
    }

    @Test
    @Order(2)
    @AllowLog(level = WARN, messagePattern = "second: .*")
    void allowedWarningDoesNotSeePreviousError() {
        logger.warn("second: tolerated warning");
    }

    @Test
    @Order(3)
    @ExpectLog(level = WARN, loggerPattern = "org\\.cognita\\..*", messagePattern = "third: repeated", occurrences = 3)
    void occurrencesAreCountedPerTest() {
        for (int i = 0; i < 3; i++) {
            logger.warn("third: repeated");
        }
    }

    @Test
    @Order(4)
    void noWarningsLeakFromEarlierTests() {
        logger.info("fourth: info only");
    }

    @Test
    @Order(5)
    @FailOnLog(disabled = true)
    void disabledWatchToleratesAnything() {
        logger.error("fifth: unchecked error");
    }

    @Test
    @Order(6)
    void backgroundThreadsAreWatched() throws InterruptedException {
        Thread worker = new Thread(() -> logger.info("sixth: from worker"));
        worker.start();
        worker.join();
    }
}
