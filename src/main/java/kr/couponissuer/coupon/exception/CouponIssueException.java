package kr.couponissuer.coupon.exception;

/**
 * Issuing a single coupon failed. Recorded in that coupon's result; the batch goes on.
 */
public class CouponIssueException extends RuntimeException {

    public CouponIssueException(String message) {
        super(message);
    }

    public CouponIssueException(String message, Throwable cause) {
        super(message, cause);
    }
}
