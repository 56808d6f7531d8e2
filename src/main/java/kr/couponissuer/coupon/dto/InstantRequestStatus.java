package kr.couponissuer.coupon.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Content of a polled instant coupon request (creation or item application).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstantRequestStatus(
    String requestedId,
    String status,
    Long couponId,
    List<FailedVendorItem> failedVendorItems
) {

    public RequestStatus requestStatus() {
        return RequestStatus.from(status);
    }

    public List<FailedVendorItem> failedItems() {
        return failedVendorItems == null ? List.of() : failedVendorItems;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FailedVendorItem(Long vendorItemId, String reason) {
    }
}
