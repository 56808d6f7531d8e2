package kr.couponissuer.coupon.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntUnaryOperator;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import kr.couponissuer.coupon.config.IssuerProperties;
import kr.couponissuer.coupon.exception.IssuerInitializationException;

/**
 * Random start delay so that many installations do not hit the vendor API in the same second.
 */
@Component
@Slf4j
public class JitterDelay {

    static final int MAX_JITTER_MINUTES = 120;

    private final int maxMinutes;
    private final Sleeper sleeper;
    private final IntUnaryOperator random;

    @Autowired
    public JitterDelay(IssuerProperties properties, Sleeper sleeper) {
        this(properties.getJitterMaxMinutes(), sleeper, bound -> ThreadLocalRandom.current().nextInt(bound + 1));
    }

    JitterDelay(int maxMinutes, Sleeper sleeper, IntUnaryOperator random) {
        if (maxMinutes != 0 && (maxMinutes < 1 || maxMinutes > MAX_JITTER_MINUTES)) {
            throw new IssuerInitializationException(
                "jitter-max-minutes는 1-" + MAX_JITTER_MINUTES + " 범위여야 합니다 (현재: " + maxMinutes + ")");
        }
        this.maxMinutes = maxMinutes;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * @return the delay actually waited
     */
    public Duration await() throws InterruptedException {
        if (maxMinutes == 0) {
            return Duration.ZERO;
        }

        int minutes = random.applyAsInt(maxMinutes);
        log.info("Jitter 대기 시작 (지연: +{}분)", minutes);
        if (minutes == 0) {
            return Duration.ZERO;
        }

        Duration delay = Duration.ofMinutes(minutes);
        sleeper.sleep(delay);
        log.info("Jitter 대기 완료. 쿠폰 발급을 시작합니다.");
        return delay;
    }
}
