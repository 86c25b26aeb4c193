package agentswarm.coordinator.util;

import java.time.Duration;

/**
 * Blocking pause, injectable so polling loops can run on a virtual clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
