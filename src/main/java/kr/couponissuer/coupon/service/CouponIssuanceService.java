package kr.couponissuer.coupon.service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import kr.couponissuer.coupon.client.CoupangApiClient;
import kr.couponissuer.coupon.config.IssuerProperties;
import kr.couponissuer.coupon.dto.Contract;
import kr.couponissuer.coupon.dto.CouponItemResult;
import kr.couponissuer.coupon.dto.DownloadCouponRequest;
import kr.couponissuer.coupon.dto.DownloadCouponRequest.DownloadCouponPolicy;
import kr.couponissuer.coupon.dto.ExpireCouponRequest;
import kr.couponissuer.coupon.dto.InstantCouponRequest;
import kr.couponissuer.coupon.dto.InstantRequestStatus;
import kr.couponissuer.coupon.dto.IssueResult;
import kr.couponissuer.coupon.dto.IssueSummary;
import kr.couponissuer.coupon.dto.RequestStatus;
import kr.couponissuer.coupon.entity.Coupon;
import kr.couponissuer.coupon.entity.Coupon.CouponKind;
import kr.couponissuer.coupon.entity.IssuanceRecord;
import kr.couponissuer.coupon.exception.CoupangApiException;
import kr.couponissuer.coupon.exception.CouponIssueException;
import kr.couponissuer.coupon.exception.IssuerInitializationException;
import kr.couponissuer.coupon.repository.IssuanceLedgerRepository;

/**
 * Issues a batch of coupons, strictly one after another.
 * <ol>
 *   <li>resolve the non-contract-based billing contract (fatal when missing)</li>
 *   <li>expire the download coupons recorded by the previous run and clear the ledger</li>
 *   <li>issue every coupon; a failure is recorded in that coupon's result and the batch goes on</li>
 * </ol>
 */
@Service
@Slf4j
public class CouponIssuanceService {

    static final DateTimeFormatter VENDOR_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String EXPIRE_REASON = "expired";

    private final CoupangApiClient apiClient;
    private final IssuanceLedgerRepository ledgerRepository;
    private final IssuerProperties properties;
    private final Clock clock;
    private final RequestStatusPoller poller;

    @Autowired
    public CouponIssuanceService(CoupangApiClient apiClient,
                                 IssuanceLedgerRepository ledgerRepository,
                                 IssuerProperties properties,
                                 Clock clock,
                                 Sleeper sleeper) {
        this(apiClient, ledgerRepository, properties, clock, new RequestStatusPoller(apiClient, sleeper,
            properties.getPolling().getMaxAttempts(), properties.getPolling().getInterval()));
    }

    CouponIssuanceService(CoupangApiClient apiClient,
                          IssuanceLedgerRepository ledgerRepository,
                          IssuerProperties properties,
                          Clock clock,
                          RequestStatusPoller poller) {
        this.apiClient = apiClient;
        this.ledgerRepository = ledgerRepository;
        this.properties = properties;
        this.clock = clock;
        this.poller = poller;
    }

    public IssueSummary issueAll(List<Coupon> coupons) {
        checkCredentials();
        long contractId = resolveContractId();
        log.info("설정 로드 완료 (Vendor: {}, Contract: {})", properties.getCoupang().getVendorId(), contractId);

        expirePreviouslyIssued();

        log.info("쿠폰 발급 처리 중: 총 {}개", coupons.size());
        List<IssueResult> results = new ArrayList<>();
        int index = 1;
        for (Coupon coupon : coupons) {
            results.add(issue(index++, coupon, contractId));
        }

        IssueSummary summary = new IssueSummary(results);
        log.info("쿠폰 발급 완료! (성공: {}, 실패: {})", summary.successCount(), summary.failureCount());
        return summary;
    }

    private void checkCredentials() {
        IssuerProperties.Coupang coupang = properties.getCoupang();
        if (isBlank(coupang.getAccessKey()) || isBlank(coupang.getSecretKey())) {
            throw new IssuerInitializationException("API 키가 설정되지 않았습니다 (access-key, secret-key)");
        }
        if (isBlank(coupang.getVendorId()) || isBlank(coupang.getUserId())) {
            throw new IssuerInitializationException("쿠폰 정보가 설정되지 않았습니다 (vendor-id, user-id)");
        }
    }

    /**
     * Uses the configured contract id when present, otherwise the single NON_CONTRACT_BASED contract
     * with vendor contract code -1.
     */
    long resolveContractId() {
        Long configured = properties.getCoupang().getContractId();
        if (configured != null) {
            return configured;
        }

        List<Contract> contracts;
        try {
            contracts = apiClient.listContracts(properties.getCoupang().getVendorId());
        } catch (CoupangApiException e) {
            throw new IssuerInitializationException("계약 목록 조회 실패: " + e.getMessage(), e);
        }

        List<Contract> free = contracts.stream()
            .filter(Contract::isNonContractBased)
            .toList();
        if (free.size() != 1) {
            throw new IssuerInitializationException(
                "자유계약기반(NON_CONTRACT_BASED) 계약을 하나로 특정할 수 없습니다 (발견: " + free.size() + "개)");
        }
        return free.get(0).contractId();
    }

    /**
     * Expires every ledgered download coupon in one call. The ledger is emptied afterwards even when
     * some or all expiries fail, so it never grows from run to run.
     */
    void expirePreviouslyIssued() {
        List<IssuanceRecord> records;
        try {
            records = ledgerRepository.findAll();
        } catch (UncheckedIOException e) {
            log.error("발급 이력을 읽을 수 없어 이전 쿠폰 파기를 건너뜁니다: {}", e.getMessage());
            clearLedger();
            return;
        }

        if (records.isEmpty()) {
            log.info("파기할 이전 다운로드쿠폰이 없습니다");
            return;
        }

        String userId = properties.getCoupang().getUserId();
        List<ExpireCouponRequest> requests = records.stream()
            .map(record -> new ExpireCouponRequest(record.getCouponId(), EXPIRE_REASON, userId))
            .toList();

        log.info("이전 다운로드쿠폰 {}개 파기 요청", requests.size());
        try {
            List<CouponItemResult> results = apiClient.expireDownloadCoupons(requests);
            for (CouponItemResult result : results) {
                if (result.isSuccess()) {
                    log.info("[OK] 쿠폰 파기 완료 (couponId: {})", result.couponId());
                } else {
                    log.warn("[FAIL] 쿠폰 파기 실패 (couponId: {}): {}", result.couponId(), result.errorMessage());
                }
            }
        } catch (CoupangApiException e) {
            log.warn("이전 다운로드쿠폰 파기 요청 실패: {}", e.getMessage());
        } finally {
            clearLedger();
        }
    }

    private void clearLedger() {
        try {
            ledgerRepository.clear();
        } catch (UncheckedIOException e) {
            log.error("발급 이력 초기화 실패: {}", e.getMessage());
        }
    }

    IssueResult issue(int index, Coupon coupon, long contractId) {
        log.info("[{}] {} ({}) 발급 중...", index, coupon.getName(), coupon.getKind().getLabel());
        try {
            IssueResult result = switch (coupon.getKind()) {
                case INSTANT -> issueInstant(index, coupon, contractId);
                case DOWNLOAD -> issueDownload(index, coupon, contractId);
            };
            log.info("[{}] [OK] {}: {}", index, coupon.getName(), result.message());
            return result;
        } catch (CouponIssueException | CoupangApiException e) {
            log.warn("[{}] [FAIL] {}: {}", index, coupon.getName(), e.getMessage());
            return IssueResult.failure(index, coupon.getName(), coupon.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] [FAIL] {}: 예상하지 못한 오류", index, coupon.getName(), e);
            return IssueResult.failure(index, coupon.getName(), coupon.getKind(), "예상하지 못한 오류: " + e.getMessage());
        }
    }

    // ===== INSTANT: create -> poll -> apply items -> poll =====

    private IssueResult issueInstant(int index, Coupon coupon, long contractId) {
        String vendorId = properties.getCoupang().getVendorId();
        LocalDateTime start = LocalDate.now(clock).atStartOfDay();
        LocalDateTime end = validityEnd(coupon);

        InstantCouponRequest request = new InstantCouponRequest(
            contractId,
            coupon.getName(),
            coupon.getMaxDiscountPrice(),
            coupon.getDiscountValue(),
            start.format(VENDOR_DATE),
            end.format(VENDOR_DATE),
            coupon.getDiscountMode().getVendorCode());

        String createRequestId = apiClient.createInstantCoupon(vendorId, request);
        if (createRequestId == null) {
            throw new CouponIssueException("즉시할인쿠폰 생성 실패 (requestedId 없음)");
        }

        InstantRequestStatus created = poller.await(vendorId, createRequestId, "즉시할인쿠폰 생성");
        if (created.requestStatus() != RequestStatus.DONE) {
            throw new CouponIssueException("즉시할인쿠폰 생성 실패 (status=" + created.status() + ")");
        }
        Long couponId = created.couponId();
        if (couponId == null) {
            throw new CouponIssueException("즉시할인쿠폰 생성 실패 (couponId 없음)");
        }

        String applyRequestId = apiClient.applyInstantCouponItems(vendorId, couponId, coupon.getVendorItemIds());
        if (applyRequestId == null) {
            throw new CouponIssueException("즉시할인쿠폰 아이템 적용 실패 (requestedId 없음, couponId: " + couponId + ")");
        }

        InstantRequestStatus applied = poller.await(vendorId, applyRequestId, "즉시할인쿠폰 아이템 적용");
        List<InstantRequestStatus.FailedVendorItem> failedItems = applied.failedItems();
        if (applied.requestStatus() != RequestStatus.DONE || !failedItems.isEmpty()) {
            String details = failedItems.stream()
                .map(item -> item.vendorItemId() + ": " + item.reason())
                .collect(Collectors.joining(", "));
            throw new CouponIssueException("즉시할인쿠폰 아이템 적용 실패 (couponId: " + couponId
                + ", status=" + applied.status() + ", 실패: " + details + ")");
        }

        return IssueResult.success(index, coupon.getName(), CouponKind.INSTANT, couponId,
            "즉시할인쿠폰 생성 완료 (couponId: " + couponId + ", 옵션 " + coupon.getVendorItemIds().size() + "개 적용)");
    }

    // ===== DOWNLOAD: create -> apply items -> ledger =====

    private IssueResult issueDownload(int index, Coupon coupon, long contractId) {
        String userId = properties.getCoupang().getUserId();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime start = now.plus(properties.getLimits().getDownloadStartDelay());
        LocalDateTime end = validityEnd(coupon);

        DownloadCouponPolicy policy = new DownloadCouponPolicy(
            coupon.getName(),
            coupon.getDiscountMode().getVendorCode(),
            coupon.getName() + " (" + coupon.getValidityDays() + "일간 유효)",
            coupon.getMinPurchasePrice(),
            coupon.getDiscountValue(),
            coupon.getMaxDiscountPrice(),
            coupon.getIssueCount());

        DownloadCouponRequest request = new DownloadCouponRequest(
            coupon.getName(),
            contractId,
            "DOWNLOAD",
            start.format(VENDOR_DATE),
            end.format(VENDOR_DATE),
            userId,
            List.of(policy));

        Long couponId = apiClient.createDownloadCoupon(request);
        if (couponId == null) {
            throw new CouponIssueException("다운로드쿠폰 생성 실패 (couponId 없음)");
        }

        List<CouponItemResult> results = apiClient.applyDownloadCouponItems(couponId, userId, coupon.getVendorItemIds());
        if (results.isEmpty()) {
            throw new CouponIssueException("다운로드쿠폰 아이템 적용 실패: 응답 없음 (couponId: " + couponId + ")");
        }
        CouponItemResult first = results.get(0);
        if (!first.isSuccess()) {
            String error = first.errorMessage() != null ? first.errorMessage() : "Unknown error";
            throw new CouponIssueException("다운로드쿠폰 아이템 적용 실패: " + error + " (couponId: " + couponId + ")");
        }

        try {
            ledgerRepository.append(new IssuanceRecord(coupon.getName(), couponId, now));
        } catch (UncheckedIOException e) {
            throw new CouponIssueException("다운로드쿠폰 발급 완료(couponId: " + couponId
                + ") 후 발급 이력 기록 실패: " + e.getMessage(), e);
        }

        return IssueResult.success(index, coupon.getName(), CouponKind.DOWNLOAD, couponId,
            "다운로드쿠폰 생성 완료 (couponId: " + couponId + ", 옵션 " + coupon.getVendorItemIds().size() + "개 적용)");
    }

    // 23:59 on the last valid day, counted from today's midnight
    private LocalDateTime validityEnd(Coupon coupon) {
        return LocalDate.now(clock).atStartOfDay()
            .plusDays(coupon.getValidityDays())
            .minusMinutes(1);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
