package com.flinkcursor.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for flinkcursor tests.
 *
 * <p>Subclasses override {@link #doSetUp()} and {@link #doTearDown()}
 * instead of declaring their own lifecycle methods, and use
 * {@link #logStep(String)} to narrate multi-step scenarios.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    @BeforeEach
    void setUpBase(TestInfo testInfo) {
        logger.debug("Running {}", testInfo.getDisplayName());
        doSetUp();
    }

    @AfterEach
    void tearDownBase() {
        doTearDown();
    }

    protected void doSetUp() {
    }

    protected void doTearDown() {
    }

    protected void logStep(String step) {
        logger.info(step);
    }
}
