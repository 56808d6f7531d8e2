package kr.couponissuer.coupon.exception;

import lombok.Getter;

/**
 * Spreadsheet is malformed or a row breaks a coupon rule. Aborts the batch before any vendor call.
 */
@Getter
public class CouponValidationException extends RuntimeException {

    private final int row;
    private final String reason;

    public CouponValidationException(int row, String reason) {
        super("행 " + row + ": " + reason);
        this.row = row;
        this.reason = reason;
    }

    public CouponValidationException(String message, Throwable cause) {
        super(message, cause);
        this.row = 0;
        this.reason = message;
    }
}
