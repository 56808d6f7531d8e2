package kr.couponissuer.coupon.repository;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import kr.couponissuer.coupon.entity.IssuanceRecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("발급 이력 저장소 테스트")
class IssuanceLedgerRepositoryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Clock clock = Clock.fixed(Instant.parse("2024-12-17T15:00:00Z"), ZoneId.of("Asia/Seoul"));

    private Path ledgerFile;
    private IssuanceLedgerRepository repository;

    @BeforeEach
    void setUp() {
        ledgerFile = tempDir.resolve("data").resolve("issued_coupons.json");
        repository = new IssuanceLedgerRepository(ledgerFile, objectMapper, clock);
    }

    @Test
    @DisplayName("파일이 없으면 빈 목록이다")
    void emptyWhenFileMissing() {
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    @DisplayName("추가한 이력은 순서대로 다시 읽힌다")
    void appendsInOrder() {
        repository.append(new IssuanceRecord("첫번째", 1L, LocalDateTime.of(2024, 12, 18, 0, 0, 5)));
        repository.append(new IssuanceRecord("두번째", 2L, LocalDateTime.of(2024, 12, 18, 0, 0, 9)));

        assertThat(repository.findAll())
            .extracting(IssuanceRecord::getName, IssuanceRecord::getCouponId)
            .containsExactly(
                org.assertj.core.groups.Tuple.tuple("첫번째", 1L),
                org.assertj.core.groups.Tuple.tuple("두번째", 2L));
    }

    @Test
    @DisplayName("파일 형식은 lastUpdated와 coupons 배열이다")
    void writesLedgerShape() throws Exception {
        repository.append(new IssuanceRecord("쿠폰", 42L, LocalDateTime.of(2024, 12, 18, 0, 0, 0)));

        JsonNode json = objectMapper.readTree(ledgerFile.toFile());

        assertThat(json.path("lastUpdated").asText()).isEqualTo("2024-12-18 00:00:00");
        assertThat(json.path("coupons")).hasSize(1);
        assertThat(json.path("coupons").get(0).path("couponId").asLong()).isEqualTo(42L);
        assertThat(json.path("coupons").get(0).path("issuedAt").asText()).isEqualTo("2024-12-18 00:00:00");
    }

    @Test
    @DisplayName("초기화하면 빈 이력이 된다")
    void clearEmptiesLedger() {
        repository.append(new IssuanceRecord("쿠폰", 1L, LocalDateTime.now(clock)));

        repository.clear();

        assertThat(repository.findAll()).isEmpty();
        assertThat(Files.exists(ledgerFile)).isTrue();
    }

    @Test
    @DisplayName("손상된 파일은 읽기 예외가 된다")
    void corruptFileFails() throws Exception {
        Files.createDirectories(ledgerFile.getParent());
        Files.writeString(ledgerFile, "{not json");

        assertThatThrownBy(() -> repository.findAll())
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("발급 이력 파일 읽기 실패");
    }
}
