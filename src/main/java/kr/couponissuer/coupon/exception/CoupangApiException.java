package kr.couponissuer.coupon.exception;

import lombok.Getter;

/**
 * Any failed vendor call: network failure, HTTP status 400 or above, or an error {@code code} in a 2xx body.
 */
@Getter
public class CoupangApiException extends RuntimeException {

    // null when the request never got a response
    private final Integer httpStatus;

    public CoupangApiException(Integer httpStatus, String message) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public CoupangApiException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = null;
    }
}
