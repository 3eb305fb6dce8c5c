// file: server/src/main/java/io/inksync/server/resolution/RiskLevel.java
package io.inksync.server.resolution;

public enum RiskLevel {
    LOW, MEDIUM, HIGH
}
