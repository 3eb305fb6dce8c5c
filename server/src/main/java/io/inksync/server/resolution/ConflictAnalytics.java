// file: server/src/main/java/io/inksync/server/resolution/ConflictAnalytics.java
package io.inksync.server.resolution;

import io.inksync.core.conflict.ConflictType;
import io.inksync.core.conflict.Severity;

import java.util.List;
import java.util.Map;

/**
 * Reporting view over the audit log.
 * <p>
 * A degraded result (storage unreadable) has every count at zero and carries
 * the error message; it is still a valid, serializable answer.
 *
 * @param resolutionSuccessRate   resolved conflicts / distinct conflicts
 * @param automaticResolutionRate automatically resolved conflicts / distinct conflicts
 * @param userParticipation       userId -> number of distinct conflicts involving the user
 * @param peakHours               UTC hour of detection with counts, busiest first
 * @param dailyTrend              UTC day (ISO date) with counts, oldest first
 */
public record ConflictAnalytics(
        String whiteboardId,
        TimeRange range,
        long totalConflicts,
        Map<ConflictType, Long> byType,
        Map<Severity, Long> bySeverity,
        double averageResolutionMillis,
        double resolutionSuccessRate,
        double automaticResolutionRate,
        Map<String, Long> userParticipation,
        List<HourCount> peakHours,
        List<DayCount> dailyTrend,
        boolean degraded,
        String error
) {

    public record HourCount(int hourUtc, long count) {}

    public record DayCount(String day, long count) {}

    public ConflictAnalytics {
        byType = Map.copyOf(byType);
        bySeverity = Map.copyOf(bySeverity);
        userParticipation = Map.copyOf(userParticipation);
        peakHours = List.copyOf(peakHours);
        dailyTrend = List.copyOf(dailyTrend);
    }

    static ConflictAnalytics degraded(String whiteboardId, TimeRange range, String error) {
        return new ConflictAnalytics(whiteboardId, range, 0, Map.of(), Map.of(), 0.0, 0.0, 0.0,
                Map.of(), List.of(), List.of(), true, error);
    }
}
