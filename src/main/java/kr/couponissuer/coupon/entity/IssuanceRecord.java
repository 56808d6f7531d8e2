package kr.couponissuer.coupon.entity;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonFormat;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A download coupon this tool created, kept until the next run expires it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssuanceRecord {

    private String name;

    private Long couponId;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime issuedAt;
}
