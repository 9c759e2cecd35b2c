package com.meltwater.amqpexchange;

import com.meltwater.amqpexchange.util.Logger;
import org.junit.Assume;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * Skips the tests when no broker is reachable and logs the tests that fail against it.
 *
 * The broker is probed once per JVM.
 */
public class BrokerAvailableRule extends TestWatcher {

    private static final Logger log = new Logger(BrokerAvailableRule.class);

    private static Boolean brokerAvailable;

    @Override
    public Statement apply(Statement base, Description description) {
        final Statement watched = super.apply(base, description);
        return new Statement() {
            @Override
            public void evaluate() throws Throwable {
                Assume.assumeTrue("No broker reachable at " + RabbitTestUtils.AMQP_TEST_URI_ENV, isBrokerAvailable());
                watched.evaluate();
            }
        };
    }

    @Override
    protected void failed(Throwable e, Description description) {
        log.errorWithParams("TEST FAILED", e, "name", description.toString());
    }

    private static synchronized boolean isBrokerAvailable() {
        if (brokerAvailable == null) {
            brokerAvailable = RabbitTestUtils.isBrokerAvailable();
            if (!brokerAvailable) {
                log.warnWithParams("Skipping broker tests.", "env", RabbitTestUtils.AMQP_TEST_URI_ENV);
            }
        }
        return brokerAvailable;
    }
}
