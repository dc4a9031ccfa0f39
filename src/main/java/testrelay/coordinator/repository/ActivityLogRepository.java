package testrelay.coordinator.repository;

import testrelay.coordinator.model.ActivityEvent;

import java.time.Instant;
import java.util.List;

/**
 * Append-only audit log sink.
 */
public interface ActivityLogRepository {

    void append(ActivityEvent event);

    List<ActivityEvent> findRecent(String eventType, int limit);

    int deleteBefore(Instant cutoff);
}
