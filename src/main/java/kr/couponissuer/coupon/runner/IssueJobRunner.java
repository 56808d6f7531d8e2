package kr.couponissuer.coupon.runner;

import java.nio.file.Path;
import java.util.List;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import kr.couponissuer.coupon.config.IssuerProperties;
import kr.couponissuer.coupon.dto.IssueResult;
import kr.couponissuer.coupon.dto.IssueSummary;
import kr.couponissuer.coupon.entity.Coupon;
import kr.couponissuer.coupon.exception.CouponValidationException;
import kr.couponissuer.coupon.exception.IssuerInitializationException;
import kr.couponissuer.coupon.service.CouponIssuanceService;
import kr.couponissuer.coupon.service.CouponSheetReader;
import kr.couponissuer.coupon.service.JitterDelay;

/**
 * One-shot job: {@code issue [excel]} (default) or {@code verify [excel]}.
 * <p>
 * Exit codes: 0 all coupons issued, 1 spreadsheet or setup error, 2 at least one coupon failed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IssueJobRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_PARTIAL_FAILURE = 2;

    private final IssuerProperties properties;
    private final CouponSheetReader sheetReader;
    private final CouponIssuanceService issuanceService;
    private final JitterDelay jitterDelay;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) throws Exception {
        String mode = args.length > 0 ? args[0] : "issue";
        Path excelPath = Path.of(args.length > 1 ? args[1] : properties.getExcelFile());

        switch (mode) {
            case "issue" -> issue(excelPath);
            case "verify" -> verify(excelPath);
            default -> {
                log.error("알 수 없는 명령: {} (issue 또는 verify)", mode);
                exitCode = EXIT_FATAL;
            }
        }
    }

    private void verify(Path excelPath) {
        log.info("엑셀 파일 검증 중: {}", excelPath);
        try {
            List<Coupon> coupons = sheetReader.read(excelPath);
            int no = 1;
            for (Coupon coupon : coupons) {
                log.info("{}. {} | {} | {}일 | {} {} | 최대 {}원 | 옵션 {}개",
                    no++, coupon.getName(), coupon.getKind().getLabel(), coupon.getValidityDays(),
                    coupon.getDiscountMode().getLabel(), coupon.getDiscountValue(),
                    coupon.getMaxDiscountPrice(), coupon.getVendorItemIds().size());
            }
            log.info("{}개 쿠폰 검증 완료", coupons.size());
        } catch (CouponValidationException e) {
            log.error("ERROR: 엑셀 검증 실패: {}", e.getMessage());
            exitCode = EXIT_FATAL;
        }
    }

    private void issue(Path excelPath) throws InterruptedException {
        log.info("쿠폰 발급 작업 시작");
        try {
            jitterDelay.await();

            log.info("엑셀 파일 읽기: {}", excelPath);
            List<Coupon> coupons = sheetReader.read(excelPath);
            if (coupons.isEmpty()) {
                log.info("발급할 쿠폰이 없습니다");
                return;
            }

            IssueSummary summary = issuanceService.issueAll(coupons);
            for (IssueResult result : summary.results()) {
                log.info("[{}] {}: {}", result.success() ? "OK" : "FAIL", result.couponName(), result.message());
            }
            if (!summary.allSucceeded()) {
                exitCode = EXIT_PARTIAL_FAILURE;
            }
        } catch (CouponValidationException | IssuerInitializationException e) {
            log.error("ERROR: 쿠폰 발급 중단: {}", e.getMessage());
            exitCode = EXIT_FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
