// file: server/src/main/java/io/inksync/server/ServerConfig.java
package io.inksync.server;

/**
 * Process configuration parsed from CLI args.
 *
 * Supports:
 *  - configPath:        optional JSON engine configuration (defaults apply when absent)
 *  - auditDir:          directory for the conflict audit log segments; null keeps the log in memory
 *  - adminPort:         port of the read-only admin HTTP surface
 *  - dedupeTtlSeconds:  how long accepted operation ids are remembered for retry detection
 */
public record ServerConfig(
        String configPath,
        String auditDir,
        int adminPort,
        long dedupeTtlSeconds
) {

    public static final long DEFAULT_AUDIT_ROTATE_BYTES = 16L * 1024 * 1024;

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --config,     -c <path>
     *   --audit-dir,  -a <path>
     *   --admin-port, -p <port>
     *   --dedupe-ttl-seconds <seconds>
     *   --help,       -h
     */
    public static ServerConfig fromArgs(String[] args) {
        String configPath = null;
        String auditDir = "./data/audit";
        int adminPort = 8480;
        long dedupeTtlSeconds = 600;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--audit-dir", "-a" -> {
                    ensureValue(args, i);
                    auditDir = args[++i];
                    if ("none".equals(auditDir)) {
                        auditDir = null;
                    }
                }

                case "--admin-port", "-p" -> {
                    ensureValue(args, i);
                    adminPort = parseInt(args[++i], "admin-port");
                }

                case "--dedupe-ttl-seconds" -> {
                    ensureValue(args, i);
                    dedupeTtlSeconds = parseInt(args[++i], "dedupe-ttl-seconds");
                    if (dedupeTtlSeconds <= 0) {
                        System.err.println("dedupe-ttl-seconds must be > 0");
                        System.exit(1);
                    }
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(configPath, auditDir, adminPort, dedupeTtlSeconds);
    }

    private static int parseInt(String raw, String option) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + option + ": " + raw);
            System.exit(1);
            return -1;
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: inksync-server [options]

            Options:
              --config,     -c   Path to JSON engine configuration (optional)
              --audit-dir,  -a   Conflict audit log directory, or "none" for in-memory (default: ./data/audit)
              --admin-port, -p   Admin HTTP port (default: 8480)
              --dedupe-ttl-seconds  TTL for operation id deduper in seconds (default: 600)
              --help,       -h   Show this help message
            """);
        System.exit(0);
    }
}
