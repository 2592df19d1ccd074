package io.coordmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class CoordMeshConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE_NAME = "coordmesh-settings.json";
    public static final String POLICY_RULES_FILE_NAME = "policy-rules.json";
    public static final long DEFAULT_LOCK_TTL_MS = 120L * 60L * 1000L;
    public static final long MAX_LOCK_TTL_MS = 7L * 24L * 60L * 60L * 1000L;
    public static final long DEFAULT_STALE_SESSION_THRESHOLD_MS = 15L * 60L * 1000L;
    public static final int DEFAULT_TASK_PRIORITY = 5;
    public static final int MIN_TASK_PRIORITY = 1;
    public static final int MAX_TASK_PRIORITY = 10;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_TRUST_LEVEL = 2;
    public static final int MIN_TRUST_LEVEL = 0;
    public static final int MAX_TRUST_LEVEL = 4;
    public static final long DEFAULT_GUARDRAIL_CACHE_TTL_MS = 60_000L;
    public static final long DEFAULT_GUARDRAIL_FALLBACK_TTL_MS = 30_000L;
    public static final long DEFAULT_POLICY_CACHE_TTL_MS = 60_000L;
    public static final int DEFAULT_AUDIT_QUEUE_CAPACITY = 1_024;
    public static final long DEFAULT_AUDIT_OFFER_TIMEOUT_MS = 250L;
    public static final int DEFAULT_AUDIT_RETENTION_DAYS = 90;
    public static final int DEFAULT_AUDIT_QUERY_LIMIT = 50;
    public static final int DEFAULT_CLAIM_MAX_RETRIES = 16;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_HANDOFF_READ_LIMIT = 1;
    public static final int MAX_HANDOFF_READ_LIMIT = 50;
    public static final int DEFAULT_RECALL_LIMIT = 10;
    public static final int MAX_RECALL_LIMIT = 100;
    public static final long MEMORY_DEDUP_WINDOW_MS = 60L * 60L * 1000L;
    public static final double MEMORY_DECAY_PER_DAY = 0.1d;

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public CoordMeshConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static CoordMeshConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static CoordMeshConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new CoordMeshConfig(scoped, base, safeNamespace);
    }

    static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path dbFile() {
        return rootDir.resolve("coordmesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path policyRulesFile() {
        return rootDir.resolve(POLICY_RULES_FILE_NAME);
    }
}
