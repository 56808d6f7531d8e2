package kr.couponissuer.coupon.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Settings under {@code issuer.*}. Every limit the reader and the issuance workflow enforce lives here
 * so tests can vary them.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "issuer")
public class IssuerProperties {

    private String excelFile = "coupons.xlsx";
    private String ledgerFile = "issued_coupons.json";
    private String timeZone = "Asia/Seoul";

    // 0 disables the start delay
    private int jitterMaxMinutes = 0;

    private Coupang coupang = new Coupang();
    private Polling polling = new Polling();
    private Limits limits = new Limits();

    @Getter
    @Setter
    public static class Coupang {
        private String baseUrl = "https://api-gateway.coupang.com";
        private String accessKey;
        private String secretKey;
        private String vendorId;
        private String userId;

        /**
         * Billing contract to use as is. Left empty, the non-contract-based contract is looked up.
         */
        private Long contractId;

        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Polling {
        private int maxAttempts = 10;
        private Duration interval = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Limits {
        private int instantMaxItems = 10_000;
        private int downloadMaxItems = 100;
        private int defaultIssueCount = 1;
        private int defaultMinPurchasePrice = 10;    // vendor minimum (10원)
        private int maxNameLength = 45;
        private Duration downloadStartDelay = Duration.ofHours(1);
    }
}
