package io.auditforge.quality;

import io.auditforge.model.WorkItem;

import java.util.List;
import java.util.Map;

/**
 * Scores a group of outputs in one invocation. Implementations must return a score for every item.
 */
public interface QualityValidator {
    Map<String, Score> validate(List<WorkItem> group);
}
