package space.ketterling.waterstress.quality;

import java.time.YearMonth;

/**
 * One recorded data-quality problem. Region and month are null when the
 * issue is not tied to one (e.g. an auxiliary key with no region).
 */
public record DataQualityIssue(IssueKind kind, String regionId, YearMonth month, String detail) {
}
