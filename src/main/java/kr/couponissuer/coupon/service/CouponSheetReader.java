package kr.couponissuer.coupon.service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import kr.couponissuer.coupon.config.IssuerProperties;
import kr.couponissuer.coupon.entity.Coupon;
import kr.couponissuer.coupon.entity.Coupon.CouponKind;
import kr.couponissuer.coupon.entity.Coupon.DiscountMode;
import kr.couponissuer.coupon.exception.CouponValidationException;

/**
 * Reads the coupon spreadsheet (first sheet, first row = headers) into validated {@link Coupon}s.
 * <p>
 * Numeric columns are read leniently: every character other than digits and '.' is dropped and an
 * empty result counts as 0, so a value like "abc" ends up failing the "greater than 0" rule rather
 * than a separate "not a number" rule. Reading stops at the first invalid row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CouponSheetReader {

    static final String COL_NAME = "쿠폰이름";
    static final String COL_KIND = "쿠폰타입";
    static final String COL_VALIDITY = "쿠폰유효기간";
    static final String COL_DISCOUNT_MODE = "할인방식";
    static final String COL_DISCOUNT = "할인금액/비율";
    static final String COL_MIN_PURCHASE = "최소구매금액";
    static final String COL_MAX_DISCOUNT = "최대할인금액";
    static final String COL_ISSUE_COUNT = "발급개수";
    static final String COL_ITEMS = "옵션ID";
    static final String COL_ITEMS_ALIAS = "옵션 ID";

    static final List<String> REQUIRED_COLUMNS = List.of(
        COL_NAME, COL_KIND, COL_VALIDITY, COL_DISCOUNT_MODE, COL_DISCOUNT,
        COL_MIN_PURCHASE, COL_MAX_DISCOUNT, COL_ISSUE_COUNT, COL_ITEMS
    );

    private final IssuerProperties properties;
    private final DataFormatter formatter = new DataFormatter();

    public List<Coupon> read(Path excelPath) {
        if (!Files.exists(excelPath)) {
            throw new CouponValidationException("엑셀 파일이 없습니다: " + excelPath, null);
        }
        try (InputStream in = Files.newInputStream(excelPath)) {
            return read(in);
        } catch (IOException e) {
            throw new CouponValidationException("엑셀 파일 읽기 실패: " + e.getMessage(), e);
        }
    }

    public List<Coupon> read(byte[] content) {
        return read(new ByteArrayInputStream(content));
    }

    public List<Coupon> read(InputStream in) {
        try (Workbook workbook = new XSSFWorkbook(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new CouponValidationException("엑셀 시트를 찾을 수 없습니다", null);
            }
            List<Coupon> coupons = readSheet(workbook.getSheetAt(0));
            log.info("쿠폰 {}개 읽기 완료", coupons.size());
            return coupons;
        } catch (CouponValidationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new CouponValidationException("엑셀 파일 읽기 실패: " + e.getMessage(), e);
        }
    }

    private List<Coupon> readSheet(Sheet sheet) {
        Map<String, Integer> columns = headerIndex(sheet.getRow(sheet.getFirstRowNum()));

        List<Coupon> coupons = new ArrayList<>();
        for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (isEmpty(row)) {
                continue;
            }
            coupons.add(readRow(new RowValues(row, r + 1, columns)));
        }
        return coupons;
    }

    private Map<String, Integer> headerIndex(Row header) {
        Map<String, Integer> columns = new HashMap<>();
        if (header != null) {
            for (Cell cell : header) {
                String label = formatter.formatCellValue(cell).trim();
                if (!label.isEmpty()) {
                    columns.putIfAbsent(label, cell.getColumnIndex());
                }
            }
        }
        if (!columns.containsKey(COL_ITEMS) && columns.containsKey(COL_ITEMS_ALIAS)) {
            columns.put(COL_ITEMS, columns.get(COL_ITEMS_ALIAS));
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new CouponValidationException(1, "필수 컬럼이 없습니다: " + required);
            }
        }
        return columns;
    }

    private boolean isEmpty(Row row) {
        if (row == null) {
            return true;
        }
        for (Cell cell : row) {
            if (!formatter.formatCellValue(cell).isBlank()) {
                return false;
            }
        }
        return true;
    }

    private Coupon readRow(RowValues row) {
        IssuerProperties.Limits limits = properties.getLimits();
        int rowNum = row.rowNum();

        String name = row.text(COL_NAME).trim();
        if (name.isEmpty()) {
            throw new CouponValidationException(rowNum, "쿠폰이름은 필수 입력입니다");
        }
        if (name.length() > limits.getMaxNameLength()) {
            throw new CouponValidationException(rowNum,
                "쿠폰이름은 최대 " + limits.getMaxNameLength() + "자까지 가능합니다 (현재: " + name.length() + "자)");
        }

        String kindRaw = row.text(COL_KIND).trim();
        CouponKind kind = CouponKind.fromLabel(kindRaw.replaceAll("\\s+", ""))
            .orElseThrow(() -> new CouponValidationException(rowNum,
                "잘못된 쿠폰 타입 '" + kindRaw + "' (즉시할인쿠폰 또는 다운로드쿠폰만 가능)"));

        int validityDays = row.number(COL_VALIDITY);
        if (validityDays < 1) {
            throw new CouponValidationException(rowNum, "쿠폰유효기간은 1 이상이어야 합니다");
        }

        String modeRaw = row.text(COL_DISCOUNT_MODE).trim();
        DiscountMode mode = DiscountMode.fromLabel(modeRaw)
            .orElseThrow(() -> new CouponValidationException(rowNum,
                "잘못된 할인방식 '" + modeRaw + "' (정률할인/수량별 정액할인/정액할인만 가능)"));

        int discount = row.number(COL_DISCOUNT);
        if (discount <= 0) {
            throw new CouponValidationException(rowNum, "할인금액/비율은 0보다 커야 합니다");
        }

        Integer minPurchasePrice = null;
        Integer issueCount = null;
        if (kind == CouponKind.DOWNLOAD) {
            minPurchasePrice = limits.getDefaultMinPurchasePrice();
            if (!row.isBlank(COL_MIN_PURCHASE)) {
                minPurchasePrice = row.number(COL_MIN_PURCHASE);
                if (minPurchasePrice < 1) {
                    throw new CouponValidationException(rowNum,
                        "최소구매금액은 1원 이상이어야 합니다 (현재: " + minPurchasePrice + ")");
                }
            }
        }

        int maxDiscountPrice = row.number(COL_MAX_DISCOUNT);
        if (maxDiscountPrice <= 0) {
            throw new CouponValidationException(rowNum, "최대할인금액은 0보다 커야 합니다");
        }

        if (kind == CouponKind.DOWNLOAD) {
            issueCount = limits.getDefaultIssueCount();
            if (!row.isBlank(COL_ISSUE_COUNT)) {
                issueCount = row.number(COL_ISSUE_COUNT);
                if (issueCount < 1) {
                    throw new CouponValidationException(rowNum, "발급개수는 1 이상이어야 합니다 (현재: " + issueCount + ")");
                }
            }
        }

        validateDiscount(rowNum, kind, mode, discount);

        List<Long> vendorItemIds = vendorItems(row, kind);

        return Coupon.builder()
            .name(name)
            .kind(kind)
            .validityDays(validityDays)
            .discountMode(mode)
            .discountValue(discount)
            .minPurchasePrice(minPurchasePrice)
            .maxDiscountPrice(maxDiscountPrice)
            .issueCount(issueCount)
            .vendorItemIds(List.copyOf(vendorItemIds))
            .build();
    }

    private void validateDiscount(int rowNum, CouponKind kind, DiscountMode mode, int discount) {
        switch (mode) {
            case RATE -> {
                int max = kind == CouponKind.DOWNLOAD ? 99 : 100;
                if (discount < 1 || discount > max) {
                    throw new CouponValidationException(rowNum,
                        kind.getLabel() + " 정률할인은 1~" + max + " 사이여야 합니다 (현재: " + discount + ")");
                }
            }
            case FIXED_PRICE -> {
                if (kind == CouponKind.DOWNLOAD) {
                    if (discount < 10) {
                        throw new CouponValidationException(rowNum,
                            "다운로드쿠폰 정액할인은 최소 10원 이상이어야 합니다 (현재: " + discount + ")");
                    }
                    if (discount % 10 != 0) {
                        throw new CouponValidationException(rowNum,
                            "다운로드쿠폰 정액할인은 10원 단위여야 합니다 (현재: " + discount + ")");
                    }
                } else if (discount < 1) {
                    throw new CouponValidationException(rowNum,
                        "즉시할인쿠폰 정액할인은 1원 이상이어야 합니다 (현재: " + discount + ")");
                }
            }
            case FIXED_PER_UNIT -> {
                if (discount < 1) {
                    throw new CouponValidationException(rowNum,
                        "수량별 정액할인은 1 이상이어야 합니다 (현재: " + discount + ")");
                }
            }
        }
    }

    private List<Long> vendorItems(RowValues row, CouponKind kind) {
        int rowNum = row.rowNum();
        String raw = row.text(COL_ITEMS).trim();
        if (raw.isEmpty()) {
            throw new CouponValidationException(rowNum, "옵션ID는 필수 입력입니다");
        }

        List<Long> ids = new ArrayList<>();
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            long id;
            try {
                id = Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                throw new CouponValidationException(rowNum, "옵션ID는 숫자만 입력 가능합니다 (현재값: " + raw + ")");
            }
            if (id <= 0) {
                throw new CouponValidationException(rowNum, "옵션ID는 양의 정수여야 합니다 (현재: " + id + ")");
            }
            ids.add(id);
        }
        if (ids.isEmpty()) {
            throw new CouponValidationException(rowNum, "옵션ID가 비어있습니다");
        }

        int max = kind == CouponKind.INSTANT
            ? properties.getLimits().getInstantMaxItems()
            : properties.getLimits().getDownloadMaxItems();
        if (ids.size() > max) {
            throw new CouponValidationException(rowNum, String.format(Locale.ROOT,
                "%s은 최대 %,d개의 옵션ID만 지원합니다 (현재: %d개)", kind.getLabel(), max, ids.size()));
        }
        return ids;
    }

    /**
     * Cell access for one data row, by header label.
     */
    private final class RowValues {

        private final Row row;
        private final int rowNum;
        private final Map<String, Integer> columns;

        RowValues(Row row, int rowNum, Map<String, Integer> columns) {
            this.row = row;
            this.rowNum = rowNum;
            this.columns = columns;
        }

        int rowNum() {
            return rowNum;
        }

        String text(String column) {
            Cell cell = row.getCell(columns.get(column));
            if (cell == null) {
                return "";
            }
            // General format turns 12+ digit numbers into 1.23457E+11
            if (cell.getCellType() == CellType.NUMERIC) {
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            }
            return formatter.formatCellValue(cell);
        }

        boolean isBlank(String column) {
            return text(column).isBlank();
        }

        int number(String column) {
            String raw = text(column);
            String digits = raw.replaceAll("[^\\d.]", "");
            if (digits.isEmpty()) {
                return 0;
            }
            double value;
            try {
                value = Double.parseDouble(digits);
            } catch (NumberFormatException e) {
                throw new CouponValidationException(rowNum, column + "은 숫자여야 합니다 (현재값: " + raw + ")");
            }
            if (value > Integer.MAX_VALUE) {
                throw new CouponValidationException(rowNum,
                    String.format(Locale.ROOT, "%s은 최대 %,d까지 입력 가능합니다 (현재값: %s)", column, Integer.MAX_VALUE, raw));
            }
            return (int) value;
        }
    }
}
