package kr.couponissuer.coupon.dto;

public enum RequestStatus {
    REQUESTED,
    DONE,
    FAIL;

    // Anything the vendor has not settled yet counts as still in progress
    public static RequestStatus from(String value) {
        if ("DONE".equals(value)) {
            return DONE;
        }
        if ("FAIL".equals(value)) {
            return FAIL;
        }
        return REQUESTED;
    }
}
