package kr.couponissuer.coupon.entity;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One validated row of the coupon spreadsheet.
 * <p>
 * Instances leave {@code CouponSheetReader} already checked against every range and unit rule,
 * so the issuance workflow only has to care about vendor call preconditions.
 */
@Value
@Builder
public class Coupon {

    @NonNull
    String name;

    @NonNull
    CouponKind kind;

    int validityDays;

    @NonNull
    DiscountMode discountMode;

    int discountValue;

    // DOWNLOAD only
    Integer minPurchasePrice;

    int maxDiscountPrice;

    // DOWNLOAD only (daily cap)
    Integer issueCount;

    @NonNull
    List<Long> vendorItemIds;

    public enum CouponKind {
        INSTANT("즉시할인쿠폰"),
        DOWNLOAD("다운로드쿠폰");

        private final String label;

        CouponKind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        /**
         * Classifies an already whitespace-stripped cell value. "즉시할인" alone is an older label
         * still found in sheets.
         */
        public static Optional<CouponKind> fromLabel(String normalized) {
            if (normalized.contains("즉시할인")) {
                return Optional.of(INSTANT);
            }
            if (normalized.contains("다운로드쿠폰")) {
                return Optional.of(DOWNLOAD);
            }
            return Optional.empty();
        }
    }

    public enum DiscountMode {
        RATE("정률할인", "RATE"),
        FIXED_PRICE("정액할인", "PRICE"),
        FIXED_PER_UNIT("수량별 정액할인", "FIXED_WITH_QUANTITY");

        private final String label;
        private final String vendorCode;

        DiscountMode(String label, String vendorCode) {
            this.label = label;
            this.vendorCode = vendorCode;
        }

        public String getLabel() {
            return label;
        }

        public String getVendorCode() {
            return vendorCode;
        }

        public static Optional<DiscountMode> fromLabel(String label) {
            for (DiscountMode mode : values()) {
                if (mode.label.equals(label)) {
                    return Optional.of(mode);
                }
            }
            return Optional.empty();
        }
    }
}
