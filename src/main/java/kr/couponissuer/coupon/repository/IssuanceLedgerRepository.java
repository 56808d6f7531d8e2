package kr.couponissuer.coupon.repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import kr.couponissuer.coupon.config.IssuerProperties;
import kr.couponissuer.coupon.entity.IssuanceLedger;
import kr.couponissuer.coupon.entity.IssuanceRecord;

/**
 * JSON file holding the download coupons issued by earlier runs.
 * <p>
 * Single process, no locking: the file is read once per run and rewritten whole on every change.
 */
@Repository
@Slf4j
public class IssuanceLedgerRepository {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path ledgerFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public IssuanceLedgerRepository(IssuerProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(Path.of(properties.getLedgerFile()), objectMapper, clock);
    }

    public IssuanceLedgerRepository(Path ledgerFile, ObjectMapper objectMapper, Clock clock) {
        this.ledgerFile = ledgerFile;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public List<IssuanceRecord> findAll() {
        if (!Files.exists(ledgerFile)) {
            return new ArrayList<>();
        }
        try {
            IssuanceLedger ledger = objectMapper.readValue(ledgerFile.toFile(), IssuanceLedger.class);
            return ledger.getCoupons() == null ? new ArrayList<>() : new ArrayList<>(ledger.getCoupons());
        } catch (IOException e) {
            throw new UncheckedIOException("발급 이력 파일 읽기 실패: " + ledgerFile, e);
        }
    }

    public void append(IssuanceRecord record) {
        List<IssuanceRecord> records = findAll();
        records.add(record);
        write(records);
        log.debug("발급 이력 추가: {} (couponId: {})", record.getName(), record.getCouponId());
    }

    public void clear() {
        write(new ArrayList<>());
    }

    private void write(List<IssuanceRecord> records) {
        IssuanceLedger ledger = new IssuanceLedger(LocalDateTime.now(clock).format(TIMESTAMP), records);
        try {
            Path parent = ledgerFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(ledgerFile.toFile(), ledger);
        } catch (IOException e) {
            throw new UncheckedIOException("발급 이력 파일 쓰기 실패: " + ledgerFile, e);
        }
    }
}
