package kr.couponissuer.coupon.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One element of the array the marketplace API returns for item application and expiry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CouponItemResult(
    String requestResultStatus,
    Body body,
    String errorCode,
    String errorMessage
) {

    public static final String SUCCESS = "SUCCESS";

    public boolean isSuccess() {
        return SUCCESS.equals(requestResultStatus);
    }

    public Long couponId() {
        return body == null ? null : body.couponId();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Body(Long couponId, String requestTransactionId) {
    }
}
