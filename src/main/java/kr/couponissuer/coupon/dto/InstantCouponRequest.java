package kr.couponissuer.coupon.dto;

/**
 * Body of the instant coupon creation call. Dates use {@code yyyy-MM-dd HH:mm:ss}.
 */
public record InstantCouponRequest(
    Long contractId,
    String name,
    Integer maxDiscountPrice,
    Integer discount,
    String startAt,
    String endAt,
    String type
) {
}
