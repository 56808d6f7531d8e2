package kr.couponissuer.coupon.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import kr.couponissuer.coupon.client.CoupangApiClient;
import kr.couponissuer.coupon.dto.InstantRequestStatus;
import kr.couponissuer.coupon.dto.RequestStatus;
import kr.couponissuer.coupon.exception.CouponIssueException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("요청 상태 폴링 테스트")
class RequestStatusPollerTest {

    @Mock
    private CoupangApiClient apiClient;

    private final List<Duration> sleeps = new ArrayList<>();
    private RequestStatusPoller poller;

    @BeforeEach
    void setUp() {
        poller = new RequestStatusPoller(apiClient, sleeps::add, 3, Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("REQUESTED 다음 DONE이면 DONE 상태를 돌려준다")
    void returnsWhenDone() {
        when(apiClient.getRequestStatus("V", "R"))
            .thenReturn(status("REQUESTED"))
            .thenReturn(new InstantRequestStatus("R", "DONE", 7L, null));

        InstantRequestStatus result = poller.await("V", "R", "생성");

        assertThat(result.requestStatus()).isEqualTo(RequestStatus.DONE);
        assertThat(result.couponId()).isEqualTo(7L);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("FAIL도 폴링을 끝낸다")
    void returnsWhenFailed() {
        when(apiClient.getRequestStatus("V", "R")).thenReturn(status("FAIL"));

        assertThat(poller.await("V", "R", "생성").requestStatus()).isEqualTo(RequestStatus.FAIL);
        verify(apiClient, times(1)).getRequestStatus("V", "R");
    }

    @Test
    @DisplayName("최대 횟수 동안 REQUESTED면 재시도 횟수와 대기 시간을 담아 시간 초과한다")
    void timesOut() {
        when(apiClient.getRequestStatus("V", "R")).thenReturn(status("REQUESTED"));

        assertThatThrownBy(() -> poller.await("V", "R", "즉시할인쿠폰 생성"))
            .isInstanceOf(CouponIssueException.class)
            .hasMessage("즉시할인쿠폰 생성 시간 초과 (requestedId: R, 재시도 3회 x 2초, 총 6초 대기)");
        verify(apiClient, times(3)).getRequestStatus("V", "R");
        assertThat(sleeps).hasSize(3);
    }

    @Test
    @DisplayName("1초 미만 간격은 밀리초로 보고한다")
    void timesOutWithSubSecondInterval() {
        RequestStatusPoller fast = new RequestStatusPoller(apiClient, sleeps::add, 3, Duration.ofMillis(500));
        when(apiClient.getRequestStatus("V", "R")).thenReturn(status("REQUESTED"));

        assertThatThrownBy(() -> fast.await("V", "R", "즉시할인쿠폰 아이템 적용"))
            .isInstanceOf(CouponIssueException.class)
            .hasMessage("즉시할인쿠폰 아이템 적용 시간 초과 (requestedId: R, 재시도 3회 x 500ms, 총 1500ms 대기)");
    }

    @Test
    @DisplayName("대기 중 인터럽트되면 실패로 보고하고 인터럽트 상태를 복원한다")
    void interruptedWhileWaiting() {
        RequestStatusPoller interrupted = new RequestStatusPoller(apiClient, duration -> {
            throw new InterruptedException();
        }, 3, Duration.ofSeconds(1));

        assertThatThrownBy(() -> interrupted.await("V", "R", "생성"))
            .isInstanceOf(CouponIssueException.class)
            .hasMessageContaining("중단");
        assertThat(Thread.interrupted()).isTrue();
    }

    private static InstantRequestStatus status(String value) {
        return new InstantRequestStatus("R", value, null, null);
    }
}
