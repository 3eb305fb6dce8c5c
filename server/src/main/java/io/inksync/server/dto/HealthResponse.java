// file: server/src/main/java/io/inksync/server/dto/HealthResponse.java
package io.inksync.server.dto;

import java.util.List;

/**
 * JSON response for GET /admin/health.
 *   { "status": "UP", "whiteboards": ["wb-1"], "pendingInterventions": 2,
 *     "auditFailures": 0, "notificationFailures": 0 }
 */
public class HealthResponse {
    public String status;
    public List<String> whiteboards;
    public int pendingInterventions;
    public long auditFailures;
    public long notificationFailures;
}
