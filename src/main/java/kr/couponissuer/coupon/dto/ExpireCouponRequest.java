package kr.couponissuer.coupon.dto;

public record ExpireCouponRequest(Long couponId, String reason, String userId) {
}
