package kr.couponissuer.coupon.client;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import lombok.extern.slf4j.Slf4j;
import kr.couponissuer.coupon.config.IssuerProperties;
import kr.couponissuer.coupon.dto.Contract;
import kr.couponissuer.coupon.dto.CouponItemResult;
import kr.couponissuer.coupon.dto.DownloadCouponRequest;
import kr.couponissuer.coupon.dto.ExpireCouponRequest;
import kr.couponissuer.coupon.dto.InstantCouponRequest;
import kr.couponissuer.coupon.dto.InstantRequestStatus;
import kr.couponissuer.coupon.exception.CoupangApiException;

/**
 * Signed calls to the Coupang promotion API.
 * <p>
 * Transport failures, HTTP errors and error codes inside a 2xx body all surface as
 * {@link CoupangApiException}. Nothing here retries or knows coupon rules.
 */
@Component
@Slf4j
public class CoupangApiClient {

    private static final String FMS_V1 = "/v2/providers/fms/apis/api/v1/vendors/";
    private static final String FMS_V2 = "/v2/providers/fms/apis/api/v2/vendors/";
    private static final String MARKETPLACE = "/v2/providers/marketplace_openapi/apis/api/v1";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CoupangHmacSigner signer;
    private final String baseUrl;

    public CoupangApiClient(RestClient coupangRestClient, ObjectMapper objectMapper,
                            IssuerProperties properties, Clock clock) {
        IssuerProperties.Coupang coupang = properties.getCoupang();
        this.restClient = coupangRestClient;
        this.objectMapper = objectMapper;
        this.signer = new CoupangHmacSigner(coupang.getAccessKey(), coupang.getSecretKey(), clock);
        this.baseUrl = stripTrailingSlash(coupang.getBaseUrl());
    }

    // ===== Instant coupons (asynchronous) =====

    /**
     * @return requestedId to poll, or {@code null} when the vendor did not return one
     */
    public String createInstantCoupon(String vendorId, InstantCouponRequest request) {
        JsonNode response = request(HttpMethod.POST, FMS_V2 + vendorId + "/coupon", request);
        return textOrNull(content(response).path("requestedId"));
    }

    public String applyInstantCouponItems(String vendorId, long couponId, List<Long> vendorItemIds) {
        JsonNode response = request(HttpMethod.POST,
            FMS_V1 + vendorId + "/coupons/" + couponId + "/items",
            Map.of("vendorItems", vendorItemIds));
        return textOrNull(content(response).path("requestedId"));
    }

    public InstantRequestStatus getRequestStatus(String vendorId, String requestedId) {
        JsonNode response = request(HttpMethod.GET, FMS_V1 + vendorId + "/requested/" + requestedId, null);
        return convert(content(response), InstantRequestStatus.class);
    }

    // ===== Download coupons (synchronous) =====

    /**
     * @return the new coupon id, or {@code null} when the vendor did not return one
     */
    public Long createDownloadCoupon(DownloadCouponRequest request) {
        JsonNode response = request(HttpMethod.POST, MARKETPLACE + "/coupons", request);
        JsonNode couponId = response.has("couponId") ? response.get("couponId") : response.path("body").path("couponId");
        return couponId.isNumber() || couponId.isTextual() ? couponId.asLong() : null;
    }

    public List<CouponItemResult> applyDownloadCouponItems(long couponId, String userId, List<Long> vendorItemIds) {
        Map<String, Object> item = Map.of(
            "couponId", couponId,
            "userId", userId,
            "vendorItemIds", vendorItemIds);
        JsonNode response = request(HttpMethod.PUT, MARKETPLACE + "/coupon-items", Map.of("couponItems", List.of(item)));
        return itemResults(response);
    }

    public List<CouponItemResult> expireDownloadCoupons(List<ExpireCouponRequest> coupons) {
        JsonNode response = request(HttpMethod.POST, MARKETPLACE + "/coupons/expire", Map.of("expireCouponList", coupons));
        return itemResults(response);
    }

    // ===== Contracts =====

    public List<Contract> listContracts(String vendorId) {
        JsonNode response = request(HttpMethod.GET, FMS_V2 + vendorId + "/contract/list", null);
        JsonNode content = content(response);
        List<Contract> contracts = new ArrayList<>();
        if (content.isArray()) {
            for (JsonNode node : content) {
                contracts.add(convert(node, Contract.class));
            }
        }
        return contracts;
    }

    // ===== Low level =====

    /**
     * Sends one signed request. {@code path} may carry a query string; it is signed without the leading '?'.
     */
    public JsonNode request(HttpMethod method, String path, Object body) {
        String rawPath = path;
        String query = "";
        int queryStart = path.indexOf('?');
        if (queryStart >= 0) {
            rawPath = path.substring(0, queryStart);
            query = path.substring(queryStart + 1);
        }

        String authorization = signer.authorization(method.name(), rawPath, query);
        log.debug("{} {} body={}", method, path, body == null ? "(empty)" : writeForLog(body));

        RestClient.RequestBodySpec spec = restClient.method(method)
            .uri(URI.create(baseUrl + path))
            .header(HttpHeaders.AUTHORIZATION, authorization)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON);
        if (body != null) {
            spec.body(body);
        }

        try {
            return spec.exchange((request, response) -> {
                int status = response.getStatusCode().value();
                String text = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                log.debug("{} {} -> HTTP {} {}", method, path, status, text);

                JsonNode json = parse(text);
                if (status >= 400) {
                    String message = "HTTP " + status + " " + response.getStatusText();
                    String vendorMessage = vendorMessage(json);
                    if (vendorMessage != null) {
                        message += ": " + vendorMessage;
                    }
                    throw new CoupangApiException(status, message);
                }

                JsonNode code = json.path("code");
                if (code.isNumber() && code.asInt() >= 400) {
                    String vendorMessage = vendorMessage(json);
                    throw new CoupangApiException(status, "API Error (code " + code.asInt() + "): "
                        + (vendorMessage != null ? vendorMessage : "Unknown error"));
                }
                return json;
            });
        } catch (RestClientException e) {
            log.error("Coupang API 요청 실패: {} {} - {}", method, path, e.getMessage());
            throw new CoupangApiException("Coupang API 요청 실패: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            // Gateway error pages are not JSON
            return MissingNode.getInstance();
        }
    }

    private static String vendorMessage(JsonNode json) {
        String message = textOrNull(json.path("errorMessage"));
        return message != null ? message : textOrNull(json.path("message"));
    }

    private static JsonNode content(JsonNode response) {
        return response.path("data").path("content");
    }

    private List<CouponItemResult> itemResults(JsonNode response) {
        List<CouponItemResult> results = new ArrayList<>();
        if (response.isArray()) {
            for (JsonNode node : response) {
                results.add(convert(node, CouponItemResult.class));
            }
        } else if (response.isObject()) {
            results.add(convert(response, CouponItemResult.class));
        }
        return results;
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        if (node.isMissingNode() || node.isNull()) {
            throw new CoupangApiException(null, "응답 형식 오류 (" + type.getSimpleName() + "): 내용 없음");
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new CoupangApiException(null, "응답 형식 오류 (" + type.getSimpleName() + "): " + e.getOriginalMessage());
        }
    }

    private String writeForLog(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return String.valueOf(body);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
