package kr.couponissuer.coupon.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Contract(
    Long contractId,
    Long vendorContractId,
    String type,
    String sellerId,
    String start,
    String end
) {

    public static final String NON_CONTRACT_BASED = "NON_CONTRACT_BASED";
    public static final long FREE_CONTRACT_CODE = -1L;

    public boolean isNonContractBased() {
        return NON_CONTRACT_BASED.equals(type)
            && vendorContractId != null
            && vendorContractId == FREE_CONTRACT_CODE;
    }
}
