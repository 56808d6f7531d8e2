package kr.couponissuer.coupon.runner;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import kr.couponissuer.coupon.config.IssuerProperties;
import kr.couponissuer.coupon.dto.IssueResult;
import kr.couponissuer.coupon.dto.IssueSummary;
import kr.couponissuer.coupon.entity.Coupon;
import kr.couponissuer.coupon.entity.Coupon.CouponKind;
import kr.couponissuer.coupon.entity.Coupon.DiscountMode;
import kr.couponissuer.coupon.exception.CouponValidationException;
import kr.couponissuer.coupon.exception.IssuerInitializationException;
import kr.couponissuer.coupon.service.CouponIssuanceService;
import kr.couponissuer.coupon.service.CouponSheetReader;
import kr.couponissuer.coupon.service.JitterDelay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("발급 작업 실행 테스트")
class IssueJobRunnerTest {

    @Mock
    private CouponSheetReader sheetReader;

    @Mock
    private CouponIssuanceService issuanceService;

    @Mock
    private JitterDelay jitterDelay;

    private IssueJobRunner runner;

    @BeforeEach
    void setUp() {
        IssuerProperties properties = new IssuerProperties();
        properties.setExcelFile("coupons.xlsx");
        runner = new IssueJobRunner(properties, sheetReader, issuanceService, jitterDelay);
    }

    @Test
    @DisplayName("모든 쿠폰이 성공하면 종료 코드 0")
    void allSucceeded() throws Exception {
        List<Coupon> coupons = List.of(coupon("A"));
        when(sheetReader.read(Path.of("coupons.xlsx"))).thenReturn(coupons);
        when(issuanceService.issueAll(coupons)).thenReturn(new IssueSummary(List.of(
            IssueResult.success(1, "A", CouponKind.INSTANT, 1L, "ok"))));

        runner.run();

        InOrder order = inOrder(jitterDelay, sheetReader, issuanceService);
        order.verify(jitterDelay).await();
        order.verify(sheetReader).read(Path.of("coupons.xlsx"));
        order.verify(issuanceService).issueAll(coupons);
        assertThat(runner.getExitCode()).isEqualTo(IssueJobRunner.EXIT_OK);
    }

    @Test
    @DisplayName("하나라도 실패하면 종료 코드 2")
    void partialFailure() throws Exception {
        List<Coupon> coupons = List.of(coupon("A"), coupon("B"));
        when(sheetReader.read(any(Path.class))).thenReturn(coupons);
        when(issuanceService.issueAll(coupons)).thenReturn(new IssueSummary(List.of(
            IssueResult.success(1, "A", CouponKind.INSTANT, 1L, "ok"),
            IssueResult.failure(2, "B", CouponKind.INSTANT, "HTTP 400"))));

        runner.run("issue");

        assertThat(runner.getExitCode()).isEqualTo(IssueJobRunner.EXIT_PARTIAL_FAILURE);
    }

    @Test
    @DisplayName("엑셀 검증 실패는 API 호출 없이 종료 코드 1")
    void validationFailure() throws Exception {
        when(sheetReader.read(any(Path.class))).thenThrow(new CouponValidationException(3, "잘못된 쿠폰 타입"));

        runner.run("issue");

        verify(issuanceService, never()).issueAll(anyList());
        assertThat(runner.getExitCode()).isEqualTo(IssueJobRunner.EXIT_FATAL);
    }

    @Test
    @DisplayName("초기화 실패는 종료 코드 1")
    void initializationFailure() throws Exception {
        when(sheetReader.read(any(Path.class))).thenReturn(List.of(coupon("A")));
        when(issuanceService.issueAll(anyList())).thenThrow(new IssuerInitializationException("API 키가 설정되지 않았습니다"));

        runner.run("issue");

        assertThat(runner.getExitCode()).isEqualTo(IssueJobRunner.EXIT_FATAL);
    }

    @Test
    @DisplayName("읽은 쿠폰이 없으면 발급하지 않고 종료 코드 0")
    void emptySheet() throws Exception {
        when(sheetReader.read(any(Path.class))).thenReturn(List.of());

        runner.run("issue");

        verify(issuanceService, never()).issueAll(anyList());
        assertThat(runner.getExitCode()).isEqualTo(IssueJobRunner.EXIT_OK);
    }

    @Test
    @DisplayName("verify는 인자로 받은 파일만 검증하고 발급하지 않는다")
    void verifyMode() throws Exception {
        when(sheetReader.read(Path.of("other.xlsx"))).thenReturn(List.of(coupon("A")));

        runner.run("verify", "other.xlsx");

        verify(issuanceService, never()).issueAll(anyList());
        verify(jitterDelay, never()).await();
        assertThat(runner.getExitCode()).isEqualTo(IssueJobRunner.EXIT_OK);
    }

    @Test
    @DisplayName("verify 중 검증 실패는 종료 코드 1")
    void verifyFailure() throws Exception {
        when(sheetReader.read(any(Path.class))).thenThrow(new CouponValidationException(2, "쿠폰이름은 필수 입력입니다"));

        runner.run("verify");

        assertThat(runner.getExitCode()).isEqualTo(IssueJobRunner.EXIT_FATAL);
    }

    @Test
    @DisplayName("알 수 없는 명령은 종료 코드 1")
    void unknownMode() throws Exception {
        runner.run("publish");

        verify(sheetReader, never()).read(any(Path.class));
        assertThat(runner.getExitCode()).isEqualTo(IssueJobRunner.EXIT_FATAL);
    }

    private static Coupon coupon(String name) {
        return Coupon.builder()
            .name(name)
            .kind(CouponKind.INSTANT)
            .validityDays(7)
            .discountMode(DiscountMode.RATE)
            .discountValue(10)
            .maxDiscountPrice(1000)
            .vendorItemIds(List.of(1L))
            .build();
    }
}
