package kr.couponissuer.coupon.dto;

import java.util.List;

public record IssueSummary(List<IssueResult> results) {

    public long successCount() {
        return results.stream().filter(IssueResult::success).count();
    }

    public long failureCount() {
        return results.size() - successCount();
    }

    public boolean allSucceeded() {
        return failureCount() == 0;
    }
}
