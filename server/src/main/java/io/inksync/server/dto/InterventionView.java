// file: server/src/main/java/io/inksync/server/dto/InterventionView.java
package io.inksync.server.dto;

import java.util.List;

/**
 * One pending manual intervention as listed by GET /admin/interventions/pending.
 *   { "id": "mi-wb-1:semantic:a|b", "conflictId": "wb-1:semantic:a|b", "whiteboardId": "wb-1",
 *     "conflictType": "SEMANTIC", "severity": "MEDIUM", "userIds": ["u1","u2"],
 *     "operationIds": ["a","b"], "recommendedStrategy": "MANUAL", "confidence": 0.3,
 *     "risk": "HIGH", "reasoning": "...", "alternatives": ["LAST_WRITER_WINS"], "requestedAtMillis": 1700000000000 }
 */
public class InterventionView {
    public String id;
    public String conflictId;
    public String whiteboardId;
    public String conflictType;
    public String severity;
    public List<String> userIds;
    public List<String> operationIds;
    public String recommendedStrategy;   // null when no analysis was attached
    public Double confidence;
    public String risk;
    public String reasoning;
    public List<String> alternatives;
    public long requestedAtMillis;
}
