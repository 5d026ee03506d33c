package crawl.governor.core.port.out;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Suspends only the calling task between retry attempts. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = delay -> TimeUnit.NANOSECONDS.sleep(delay.toNanos());

  void sleep(Duration delay) throws InterruptedException;
}
