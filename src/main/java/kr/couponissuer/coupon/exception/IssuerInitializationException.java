package kr.couponissuer.coupon.exception;

/**
 * The run cannot start: credentials are missing or the billing contract cannot be resolved.
 */
public class IssuerInitializationException extends RuntimeException {

    public IssuerInitializationException(String message) {
        super(message);
    }

    public IssuerInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
