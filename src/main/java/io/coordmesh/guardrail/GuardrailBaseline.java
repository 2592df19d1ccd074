package io.coordmesh.guardrail;

import io.coordmesh.model.GuardrailSeverity;

import java.util.List;

/**
 * Patterns compiled into the binary, used whenever the pattern table cannot be read.
 */
final class GuardrailBaseline {
    private static final List<GuardrailPattern> PATTERNS = List.of(
            GuardrailPattern.of("git_force_push", "git", "git\\s+push\\s+.*--force", GuardrailSeverity.BLOCK, 3,
                    "Force push rewrites shared history"),
            GuardrailPattern.of("git_reset_hard", "git", "git\\s+reset\\s+--hard", GuardrailSeverity.BLOCK, 3,
                    "Hard reset discards work"),
            GuardrailPattern.of("git_clean_force", "git", "git\\s+clean\\s+-[fd]", GuardrailSeverity.BLOCK, 3,
                    "Clean removes untracked files"),
            GuardrailPattern.of("git_branch_delete", "git", "git\\s+(branch\\s+-D|push\\s+.*--delete)",
                    GuardrailSeverity.WARN, 3, "Branch deletion"),
            GuardrailPattern.of("rm_recursive_force", "file", "rm\\s+-r[f]?\\s+/", GuardrailSeverity.BLOCK, 4,
                    "Recursive removal from an absolute path"),
            GuardrailPattern.of("rm_rf", "file", "rm\\s+-rf\\s+", GuardrailSeverity.BLOCK, 3,
                    "Recursive forced removal"),
            GuardrailPattern.of("drop_table", "database", "DROP\\s+TABLE", GuardrailSeverity.BLOCK, 4,
                    "Table drop"),
            GuardrailPattern.of("truncate_table", "database", "TRUNCATE\\s+", GuardrailSeverity.BLOCK, 4,
                    "Table truncation"),
            GuardrailPattern.of("env_file_modify", "credential", "\\.(env|env\\.local|env\\.production)",
                    GuardrailSeverity.WARN, 2, "Environment file access"),
            GuardrailPattern.of("credentials_file", "credential", "(credentials|secrets|passwords)\\.(json|yaml|yml|txt)",
                    GuardrailSeverity.WARN, 2, "Credential file access"),
            GuardrailPattern.of("deploy_command", "deployment", "(kubectl\\s+apply|terraform\\s+apply|docker\\s+push)",
                    GuardrailSeverity.BLOCK, 3, "Deployment command")
    );

    private GuardrailBaseline() {
    }

    static List<GuardrailPattern> patterns() {
        return PATTERNS;
    }
}
