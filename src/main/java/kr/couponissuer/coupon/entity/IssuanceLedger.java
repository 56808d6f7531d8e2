package kr.couponissuer.coupon.entity;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk shape of the ledger file: {@code { "lastUpdated": "...", "coupons": [...] }}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssuanceLedger {

    private String lastUpdated;

    private List<IssuanceRecord> coupons = new ArrayList<>();
}
