package kr.couponissuer.coupon.dto;

import kr.couponissuer.coupon.entity.Coupon.CouponKind;

public record IssueResult(
    int index,
    String couponName,
    CouponKind kind,
    boolean success,
    Long couponId,
    String message
) {

    public static IssueResult success(int index, String couponName, CouponKind kind, Long couponId, String message) {
        return new IssueResult(index, couponName, kind, true, couponId, message);
    }

    public static IssueResult failure(int index, String couponName, CouponKind kind, String message) {
        return new IssueResult(index, couponName, kind, false, null, message);
    }
}
