package kr.couponissuer.coupon.client;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Builds the {@code Authorization} header the Coupang gateway expects.
 * <p>
 * The signed message is {@code signedDate + method + path + query}, where {@code signedDate} is the
 * current UTC time as {@code yyMMdd'T'HHmmss'Z'} regardless of the caller's zone.
 */
public class CoupangHmacSigner {

    static final String ALGORITHM = "HmacSHA256";
    static final DateTimeFormatter SIGNED_DATE_FORMAT =
        DateTimeFormatter.ofPattern("yyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final String accessKey;
    private final String secretKey;
    private final Clock clock;

    public CoupangHmacSigner(String accessKey, String secretKey, Clock clock) {
        this.accessKey = accessKey;
        this.secretKey = secretKey;
        this.clock = clock;
    }

    public String authorization(String method, String path, String query) {
        String signedDate = SIGNED_DATE_FORMAT.format(clock.instant());
        String message = signedDate + method + path + (query == null ? "" : query);

        return "CEA algorithm=" + ALGORITHM
            + ", access-key=" + accessKey
            + ", signed-date=" + signedDate
            + ", signature=" + sign(message);
    }

    private String sign(String message) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC 서명 생성 실패", e);
        }
    }
}
