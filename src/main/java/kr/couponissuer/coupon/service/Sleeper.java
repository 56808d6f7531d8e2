package kr.couponissuer.coupon.service;

import java.time.Duration;

/**
 * Blocking wait used by polling and the start jitter. Tests swap in a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
