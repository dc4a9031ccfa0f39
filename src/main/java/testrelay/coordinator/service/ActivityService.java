package testrelay.coordinator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.model.ActivityEvent;
import testrelay.coordinator.repository.ActivityLogRepository;

import java.util.List;
import java.util.Map;

/**
 * Appends audit events. Recording is best-effort: the state change the
 * event describes has already been committed.
 */
public class ActivityService {

    private static final Logger log = LoggerFactory.getLogger(ActivityService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ActivityLogRepository activityLogRepository;

    public ActivityService(ActivityLogRepository activityLogRepository) {
        this.activityLogRepository = activityLogRepository;
    }

    public void record(String projectId, String eventType, String entityId, Map<String, ?> details) {
        try {
            String json = MAPPER.writeValueAsString(details);
            activityLogRepository.append(ActivityEvent.of(projectId, eventType, entityId, json));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to record {} event for {}: {}", eventType, entityId, e.getMessage());
        }
    }

    public List<ActivityEvent> recent(String eventType, int limit) {
        return activityLogRepository.findRecent(eventType, Math.max(1, Math.min(limit, 500)));
    }
}
