package kr.couponissuer.coupon.service;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;
import kr.couponissuer.coupon.client.CoupangApiClient;
import kr.couponissuer.coupon.dto.InstantRequestStatus;
import kr.couponissuer.coupon.exception.CouponIssueException;

/**
 * Waits for an asynchronous instant coupon request to settle.
 * <p>
 * Each attempt sleeps for the interval and then re-fetches the status. DONE and FAIL end the loop;
 * still REQUESTED after the last attempt is a timeout.
 */
@Slf4j
public class RequestStatusPoller {

    private final CoupangApiClient apiClient;
    private final Sleeper sleeper;
    private final int maxAttempts;
    private final Duration interval;

    public RequestStatusPoller(CoupangApiClient apiClient, Sleeper sleeper, int maxAttempts, Duration interval) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.apiClient = apiClient;
        this.sleeper = sleeper;
        this.maxAttempts = maxAttempts;
        this.interval = interval;
    }

    public InstantRequestStatus await(String vendorId, String requestedId, String step) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            pause(step);
            InstantRequestStatus status = apiClient.getRequestStatus(vendorId, requestedId);
            switch (status.requestStatus()) {
                case DONE, FAIL -> {
                    log.debug("{} 상태 확인 {}회차: {}", step, attempt, status.status());
                    return status;
                }
                default -> log.debug("{} 처리 중 ({}/{}), requestedId={}", step, attempt, maxAttempts, requestedId);
            }
        }

        throw new CouponIssueException(String.format(
            "%s 시간 초과 (requestedId: %s, 재시도 %d회 x %s, 총 %s 대기)",
            step, requestedId, maxAttempts, describe(interval), describe(interval.multipliedBy(maxAttempts))));
    }

    // "2초" for whole seconds, "500ms" otherwise
    static String describe(Duration duration) {
        if (duration.toMillisPart() == 0) {
            return duration.toSeconds() + "초";
        }
        return duration.toMillis() + "ms";
    }

    private void pause(String step) {
        try {
            sleeper.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CouponIssueException(step + " 상태 확인 중 중단되었습니다", e);
        }
    }
}
