package kr.couponissuer.coupon.dto;

import java.util.List;

public record DownloadCouponRequest(
    String title,
    Long contractId,
    String couponType,
    String startDate,
    String endDate,
    String userId,
    List<DownloadCouponPolicy> policies
) {

    public record DownloadCouponPolicy(
        String title,
        String typeOfDiscount,
        String description,
        Integer minimumPrice,
        Integer discount,
        Integer maximumDiscountPrice,
        Integer maximumPerDaily
    ) {
    }
}
