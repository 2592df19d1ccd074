package io.coordmesh.storage;

import io.coordmesh.config.CoordMeshConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Owns the SQLite file of one namespace: connection settings, schema, immutability triggers,
 * versioned migrations and the seeded defaults (guardrail patterns, profiles, network and policy rules).
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "coordmesh.schema.migration.v1";
    private static final String NOW_MS_SQL = "CAST(strftime('%s','now') AS INTEGER)*1000";

    private final CoordMeshConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(CoordMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(CoordMeshConfig.DEFAULT_BUSY_TIMEOUT_MS);
        sqlite.enforceForeignKeys(true);
        // setAutoCommit(false) opens BEGIN IMMEDIATE.
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public String namespace() {
        return config.namespace();
    }

    public CoordMeshConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
        log.debug("Database ready at {}", config.dbFile());
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS locks (
                        resource_key TEXT PRIMARY KEY,
                        holder_id TEXT NOT NULL,
                        holder_type TEXT NOT NULL DEFAULT '',
                        session_id TEXT,
                        reason TEXT,
                        metadata TEXT NOT NULL DEFAULT '{}',
                        acquired_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        task_id TEXT PRIMARY KEY,
                        task_type TEXT NOT NULL,
                        description TEXT NOT NULL DEFAULT '',
                        input_payload TEXT,
                        priority INTEGER NOT NULL CHECK (priority BETWEEN 1 AND 10),
                        status TEXT NOT NULL,
                        claimed_by TEXT,
                        claimed_at_ms INTEGER,
                        attempt_count INTEGER NOT NULL DEFAULT 0,
                        max_attempts INTEGER NOT NULL DEFAULT 3,
                        result_payload TEXT,
                        error_message TEXT,
                        deadline_ms INTEGER,
                        submitted_by TEXT NOT NULL DEFAULT '',
                        resubmitted_from TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        completed_at_ms INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_dependencies (
                        task_id TEXT NOT NULL,
                        depends_on_task_id TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(task_id, depends_on_task_id),
                        FOREIGN KEY(task_id) REFERENCES tasks(task_id),
                        FOREIGN KEY(depends_on_task_id) REFERENCES tasks(task_id)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS agent_sessions (
                        session_id TEXT PRIMARY KEY,
                        agent_id TEXT NOT NULL,
                        agent_type TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL,
                        current_task TEXT,
                        metadata TEXT NOT NULL DEFAULT '{}',
                        started_at_ms INTEGER NOT NULL,
                        last_heartbeat_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS session_capabilities (
                        session_id TEXT NOT NULL,
                        capability TEXT NOT NULL,
                        PRIMARY KEY(session_id, capability),
                        FOREIGN KEY(session_id) REFERENCES agent_sessions(session_id) ON DELETE CASCADE
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS guardrail_patterns (
                        name TEXT PRIMARY KEY,
                        category TEXT NOT NULL,
                        pattern TEXT NOT NULL,
                        severity TEXT NOT NULL DEFAULT 'block',
                        min_trust_level INTEGER NOT NULL DEFAULT 3,
                        description TEXT,
                        enabled INTEGER NOT NULL DEFAULT 1,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS guardrail_violations (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        agent_id TEXT NOT NULL,
                        pattern_name TEXT NOT NULL,
                        category TEXT NOT NULL,
                        severity TEXT NOT NULL,
                        operation_text TEXT NOT NULL,
                        matched_text TEXT NOT NULL,
                        blocked INTEGER NOT NULL,
                        bypassed INTEGER NOT NULL DEFAULT 0,
                        trust_level INTEGER NOT NULL,
                        context TEXT NOT NULL DEFAULT '{}',
                        created_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS agent_profiles (
                        profile_id TEXT PRIMARY KEY,
                        name TEXT NOT NULL UNIQUE,
                        description TEXT,
                        agent_type TEXT NOT NULL,
                        trust_level INTEGER NOT NULL DEFAULT 2 CHECK (trust_level BETWEEN 0 AND 4),
                        allowed_operations TEXT NOT NULL DEFAULT '[]',
                        blocked_operations TEXT NOT NULL DEFAULT '[]',
                        max_file_modifications INTEGER NOT NULL DEFAULT 50,
                        max_execution_time_seconds INTEGER NOT NULL DEFAULT 300,
                        max_api_calls_per_hour INTEGER NOT NULL DEFAULT 1000,
                        network_overrides TEXT NOT NULL DEFAULT '{}',
                        enabled INTEGER NOT NULL DEFAULT 1,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agent_profile_assignments (
                        agent_id TEXT PRIMARY KEY,
                        profile_id TEXT NOT NULL,
                        assigned_by TEXT,
                        assigned_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(profile_id) REFERENCES agent_profiles(profile_id)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS network_policies (
                        policy_id TEXT PRIMARY KEY,
                        profile_id TEXT,
                        domain_pattern TEXT NOT NULL,
                        action TEXT NOT NULL DEFAULT 'allow',
                        priority INTEGER NOT NULL DEFAULT 5,
                        description TEXT,
                        enabled INTEGER NOT NULL DEFAULT 1,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(profile_id) REFERENCES agent_profiles(profile_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS network_access_log (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        agent_id TEXT NOT NULL,
                        domain TEXT NOT NULL,
                        allowed INTEGER NOT NULL,
                        policy_id TEXT,
                        reason TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS policy_rules (
                        rule_id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        effect TEXT NOT NULL,
                        actions TEXT NOT NULL DEFAULT '["*"]',
                        resource_pattern TEXT,
                        min_trust INTEGER,
                        max_trust INTEGER,
                        priority INTEGER NOT NULL DEFAULT 50,
                        description TEXT,
                        enabled INTEGER NOT NULL DEFAULT 1,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS audit_log (
                        entry_id TEXT PRIMARY KEY,
                        agent_id TEXT NOT NULL,
                        agent_type TEXT,
                        operation TEXT NOT NULL,
                        parameters TEXT NOT NULL DEFAULT '{}',
                        result TEXT NOT NULL DEFAULT '{}',
                        duration_ms INTEGER,
                        success INTEGER,
                        error_message TEXT,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS audit_retention_grants (
                        grant_id TEXT PRIMARY KEY,
                        cutoff_ms INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS audit_log_reject_update
                    BEFORE UPDATE ON audit_log
                    BEGIN
                        SELECT RAISE(ABORT, 'audit_log entries are immutable');
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS audit_log_reject_delete
                    BEFORE DELETE ON audit_log
                    WHEN NOT EXISTS (
                        SELECT 1 FROM audit_retention_grants g WHERE OLD.created_at_ms < g.cutoff_ms
                    )
                    BEGIN
                        SELECT RAISE(ABORT, 'audit_log entries are immutable');
                    END
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS handoff_documents (
                        handoff_id TEXT PRIMARY KEY,
                        agent_id TEXT NOT NULL,
                        session_id TEXT,
                        summary TEXT NOT NULL,
                        completed_work TEXT NOT NULL DEFAULT '[]',
                        in_progress TEXT NOT NULL DEFAULT '[]',
                        decisions TEXT NOT NULL DEFAULT '[]',
                        next_steps TEXT NOT NULL DEFAULT '[]',
                        relevant_files TEXT NOT NULL DEFAULT '[]',
                        created_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS memory_episodic (
                        memory_id TEXT PRIMARY KEY,
                        agent_id TEXT NOT NULL,
                        session_id TEXT,
                        event_type TEXT NOT NULL,
                        summary TEXT NOT NULL,
                        details TEXT NOT NULL DEFAULT '{}',
                        outcome TEXT,
                        lessons TEXT NOT NULL DEFAULT '[]',
                        relevance_score REAL NOT NULL DEFAULT 1.0,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS memory_tags (
                        memory_id TEXT NOT NULL,
                        tag TEXT NOT NULL,
                        PRIMARY KEY(memory_id, tag),
                        FOREIGN KEY(memory_id) REFERENCES memory_episodic(memory_id) ON DELETE CASCADE
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS coordination_conflicts (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        event_type TEXT NOT NULL,
                        resource TEXT,
                        actor TEXT,
                        expected TEXT,
                        actual TEXT,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);

            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_locks_expires ON locks(expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_locks_holder ON locks(holder_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status_priority_created ON tasks(status, priority, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_claimed_by_status ON tasks(claimed_by, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_task_dep_depends_on ON task_dependencies(depends_on_task_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sessions_agent_heartbeat ON agent_sessions(agent_id, last_heartbeat_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sessions_status_heartbeat ON agent_sessions(status, last_heartbeat_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_session_capabilities_capability ON session_capabilities(capability)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_guardrail_violations_agent_time ON guardrail_violations(agent_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_guardrail_violations_blocked_time ON guardrail_violations(blocked, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_profiles_agent_type ON agent_profiles(agent_type)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_profile_assignments_profile ON agent_profile_assignments(profile_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_network_policies_profile ON network_policies(profile_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_network_access_log_agent_time ON network_access_log(agent_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_policy_rules_priority ON policy_rules(enabled, priority)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_audit_log_created ON audit_log(created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_audit_log_agent_created ON audit_log(agent_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_audit_log_operation ON audit_log(operation, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_handoffs_agent_created ON handoff_documents(agent_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_handoffs_session ON handoff_documents(session_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_memory_agent_type_created ON memory_episodic(agent_id, event_type, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_memory_created ON memory_episodic(created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_memory_tags_tag ON memory_tags(tag)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_conflicts_time ON coordination_conflicts(occurred_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_conflicts_type_time ON coordination_conflicts(event_type, occurred_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        for (MigrationStep step : migrationSteps()) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            log.info("Applied schema migration {}", step.version());
        }
    }

    static List<MigrationStep> migrationSteps() {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261016_001_seed_guardrail_patterns",
                "Seed destructive-operation guardrail patterns",
                List.of(
                        pattern("git_force_push", "git", "git\\s+push\\s+.*--force", "block", 3, "Force push rewrites shared history"),
                        pattern("git_reset_hard", "git", "git\\s+reset\\s+--hard", "block", 3, "Hard reset discards work"),
                        pattern("git_clean_force", "git", "git\\s+clean\\s+-[fd]", "block", 3, "Clean removes untracked files"),
                        pattern("git_branch_delete", "git", "git\\s+(branch\\s+-D|push\\s+.*--delete)", "warn", 3, "Branch deletion"),
                        pattern("rm_recursive_force", "file", "rm\\s+-r[f]?\\s+/", "block", 4, "Recursive removal from an absolute path"),
                        pattern("rm_rf", "file", "rm\\s+-rf\\s+", "block", 3, "Recursive forced removal"),
                        pattern("find_delete", "file", "find\\s+.*-delete", "warn", 3, "Bulk delete through find"),
                        pattern("drop_table", "database", "DROP\\s+TABLE", "block", 4, "Table drop"),
                        pattern("truncate_table", "database", "TRUNCATE\\s+", "block", 4, "Table truncation"),
                        pattern("delete_no_where", "database", "DELETE\\s+FROM\\s+\\w+\\s*;", "block", 3, "Unbounded delete"),
                        pattern("env_file_modify", "credential", "\\.(env|env\\.local|env\\.production)", "warn", 2, "Environment file access"),
                        pattern("credentials_file", "credential", "(credentials|secrets|passwords)\\.(json|yaml|yml|txt)", "warn", 2, "Credential file access"),
                        pattern("ssh_key_modify", "credential", "\\.ssh/(id_rsa|id_ed25519|authorized_keys)", "block", 4, "SSH key access"),
                        pattern("deploy_command", "deployment", "(kubectl\\s+apply|terraform\\s+apply|docker\\s+push)", "block", 3, "Deployment command"),
                        pattern("npm_publish", "deployment", "npm\\s+publish", "block", 3, "Package publish")
                )
        ));
        steps.add(new MigrationStep(
                "20261016_002_seed_agent_profiles",
                "Seed preconfigured agent profiles",
                List.of(
                        profile("local-cli-agent", "Local CLI agent with elevated trust", "cli_agent", 3, List.of(
                                "acquire_lock", "release_lock", "check_locks", "get_work", "complete_work", "submit_work",
                                "write_handoff", "read_handoff", "register_session", "discover_agents", "heartbeat",
                                "remember", "recall", "check_guardrails", "get_my_profile", "query_audit"), 100),
                        profile("web-reviewer", "Web reviewer with read-only access", "web_agent", 1, List.of(
                                "check_locks", "read_handoff", "discover_agents", "recall", "check_guardrails",
                                "get_my_profile", "query_audit"), 0),
                        profile("web-implementer", "Web implementer with standard trust", "web_agent", 2, List.of(
                                "acquire_lock", "release_lock", "check_locks", "get_work", "complete_work", "submit_work",
                                "write_handoff", "read_handoff", "register_session", "discover_agents", "heartbeat",
                                "remember", "recall", "check_guardrails", "get_my_profile", "query_audit"), 50),
                        profile("cloud-worker", "Cloud worker with standard trust", "cloud_worker", 2, List.of(
                                "acquire_lock", "release_lock", "check_locks", "get_work", "complete_work", "submit_work",
                                "register_session", "heartbeat", "remember", "recall", "check_guardrails",
                                "get_my_profile"), 50),
                        profile("orchestrator", "Orchestrator with elevated trust", "orchestrator", 3, List.of(
                                "acquire_lock", "release_lock", "check_locks", "get_work", "complete_work", "submit_work",
                                "write_handoff", "read_handoff", "register_session", "discover_agents", "heartbeat",
                                "remember", "recall", "check_guardrails", "get_my_profile", "query_audit",
                                "cleanup_dead_agents"), 200)
                )
        ));
        steps.add(new MigrationStep(
                "20261016_003_seed_network_policies",
                "Seed global network access policies",
                List.of(
                        networkPolicy("net_github", "github.com", 1, "GitHub"),
                        networkPolicy("net_github_subdomains", "*.github.com", 1, "GitHub subdomains"),
                        networkPolicy("net_github_api", "api.github.com", 1, "GitHub API"),
                        networkPolicy("net_npm_registry", "registry.npmjs.org", 2, "npm registry"),
                        networkPolicy("net_pypi", "pypi.org", 2, "PyPI index"),
                        networkPolicy("net_pypi_files", "files.pythonhosted.org", 2, "PyPI downloads")
                )
        ));
        steps.add(new MigrationStep(
                "20261016_004_seed_policy_rules",
                "Seed the default declarative policy rule set",
                List.of(
                        policyRule("suspended-agents", "forbid", List.of("*"), null, null, 0, 1,
                                "Deny all operations for suspended agents"),
                        policyRule("read-operations", "permit", List.of(
                                        "check_locks", "get_work", "recall", "discover_agents", "read_handoff",
                                        "query_audit", "check_guardrails"), null, null, null, 10,
                                "Allow all agents to perform read operations"),
                        policyRule("write-operations", "permit", List.of(
                                        "acquire_lock", "release_lock", "complete_work", "submit_work", "remember",
                                        "write_handoff"), null, 2, null, 20,
                                "Allow trusted agents to perform write operations"),
                        policyRule("admin-operations", "permit", List.of(
                                        "force_push", "delete_branch", "cleanup_agents"), null, 3, null, 30,
                                "Allow high-trust agents to perform admin operations"),
                        policyRule("network-github", "permit", List.of("network_access"), "github.com", null, null, 40,
                                "GitHub"),
                        policyRule("network-github-subdomains", "permit", List.of("network_access"), "*.github.com",
                                null, null, 40, "GitHub subdomains"),
                        policyRule("network-npm-registry", "permit", List.of("network_access"), "registry.npmjs.org",
                                null, null, 40, "npm registry"),
                        policyRule("network-pypi", "permit", List.of("network_access"), "pypi.org", null, null, 40,
                                "PyPI index"),
                        policyRule("network-pypi-files", "permit", List.of("network_access"), "files.pythonhosted.org",
                                null, null, 40, "PyPI downloads")
                )
        ));
        return steps;
    }

    private static String pattern(String name, String category, String regex, String severity, int minTrust, String description) {
        return "INSERT OR IGNORE INTO guardrail_patterns(name,category,pattern,severity,min_trust_level,description,enabled,created_at_ms,updated_at_ms) "
                + "VALUES('" + safeSql(name) + "','" + safeSql(category) + "','" + safeSql(regex) + "','" + safeSql(severity) + "',"
                + minTrust + ",'" + safeSql(description) + "',1," + NOW_MS_SQL + "," + NOW_MS_SQL + ")";
    }

    private static String profile(String name, String description, String agentType, int trust, List<String> allowed, int maxFiles) {
        return "INSERT OR IGNORE INTO agent_profiles(profile_id,name,description,agent_type,trust_level,allowed_operations,"
                + "blocked_operations,max_file_modifications,max_execution_time_seconds,max_api_calls_per_hour,network_overrides,"
                + "enabled,created_at_ms,updated_at_ms) VALUES('prf_" + safeSql(name) + "','" + safeSql(name) + "','"
                + safeSql(description) + "','" + safeSql(agentType) + "'," + trust + ",'" + jsonArray(allowed) + "','[]',"
                + maxFiles + ",300,1000,'{}',1," + NOW_MS_SQL + "," + NOW_MS_SQL + ")";
    }

    private static String networkPolicy(String id, String domainPattern, int priority, String description) {
        return "INSERT OR IGNORE INTO network_policies(policy_id,profile_id,domain_pattern,action,priority,description,enabled,created_at_ms) "
                + "VALUES('" + safeSql(id) + "',NULL,'" + safeSql(domainPattern) + "','allow'," + priority + ",'"
                + safeSql(description) + "',1," + NOW_MS_SQL + ")";
    }

    private static String policyRule(String name, String effect, List<String> actions, String resourcePattern,
                                     Integer minTrust, Integer maxTrust, int priority, String description) {
        return "INSERT OR IGNORE INTO policy_rules(rule_id,name,effect,actions,resource_pattern,min_trust,max_trust,priority,"
                + "description,enabled,created_at_ms,updated_at_ms) VALUES('rule_" + safeSql(name) + "','" + safeSql(name) + "','"
                + safeSql(effect) + "','" + jsonArray(actions) + "',"
                + (resourcePattern == null ? "NULL" : "'" + safeSql(resourcePattern) + "'") + ","
                + (minTrust == null ? "NULL" : minTrust) + "," + (maxTrust == null ? "NULL" : maxTrust) + ","
                + priority + ",'" + safeSql(description) + "',1," + NOW_MS_SQL + "," + NOW_MS_SQL + ")";
    }

    private static String jsonArray(List<String> values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append('"').append(safeSql(values.get(i))).append('"');
        }
        return sb.append(']').toString();
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                for (String sql : step.sql()) {
                    st.execute(sql);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
                ps.setString(1, step.version());
                ps.setString(2, step.description());
                ps.setString(3, checksum);
                ps.setLong(4, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private static String safeSql(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("'", "''");
    }

    record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
