package com.gatekeeper.core.risk;

import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ProposedAction;
import com.gatekeeper.core.model.RiskAssessmentResult;
import com.gatekeeper.core.model.RiskFactor;
import com.gatekeeper.core.model.RiskLevel;
import com.gatekeeper.core.model.TaskContext;
import com.gatekeeper.core.policy.TrustPolicy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores a proposed action set across six fixed dimensions and combines them into a
 * weighted overall risk level.
 * <p>
 * Each dimension is a keyword/pattern heuristic over action descriptions and affected paths:
 * <ul>
 *   <li>File Impact: file count plus a heavy penalty per critical file</li>
 *   <li>Security Impact: security keywords in the intent, descriptions and paths</li>
 *   <li>Reversibility: irreversible actions</li>
 *   <li>Dependency Changes: dependency manifests</li>
 *   <li>Database Impact: migrations, schemas, SQL</li>
 *   <li>API Impact: routes, endpoints, controllers</li>
 * </ul>
 * The overall score is {@code sum(subscore * weight)}. Pure and total: no side effects, never throws
 * for non-null input.
 */
@Service
public class RiskAssessor {

    static final double FILE_COUNT_WEIGHT = 0.10;
    static final double CRITICAL_FILES_WEIGHT = 0.25;
    static final double SECURITY_WEIGHT = 0.30;
    static final double DATABASE_WEIGHT = 0.25;
    static final double API_WEIGHT = 0.20;
    static final double DEPENDENCY_WEIGHT = 0.15;
    static final double REVERSIBILITY_WEIGHT = 0.10;

    static final double CRITICAL_FILE_SCORE = 4.0;
    static final double SECURITY_PATH_SCORE = 4.0;

    private static final List<Pattern> CRITICAL_FILE_PATTERNS = List.of(
            Pattern.compile("package\\.json$"),
            Pattern.compile("tsconfig\\.json$"),
            Pattern.compile("pom\\.xml$"),
            Pattern.compile("\\.env$"),
            Pattern.compile("database.*migration", Pattern.CASE_INSENSITIVE),
            Pattern.compile("auth.*config", Pattern.CASE_INSENSITIVE),
            Pattern.compile("security", Pattern.CASE_INSENSITIVE),
            Pattern.compile("config.*prod", Pattern.CASE_INSENSITIVE),
            Pattern.compile("docker.*compose", Pattern.CASE_INSENSITIVE),
            Pattern.compile("k8s.*yaml$"),
            Pattern.compile("helm.*yaml$")
    );

    private static final Pattern SECURITY_PATTERN = Pattern.compile(
            "password|secret|token|auth|security|crypto|encrypt|permission|access.*control|oauth|jwt|ssl|tls",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DEPENDENCY_MANIFEST_PATTERN = Pattern.compile(
            "package\\.json$|requirements\\.txt$|cargo\\.toml$|go\\.mod$|pom\\.xml$|build\\.gradle(\\.kts)?$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DATABASE_DESCRIPTION_PATTERN =
            Pattern.compile("database|migration|schema|sql", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATABASE_PATH_PATTERN =
            Pattern.compile("migration|schema|\\.sql$", Pattern.CASE_INSENSITIVE);

    private static final Pattern API_DESCRIPTION_PATTERN =
            Pattern.compile("api|endpoint|route|controller", Pattern.CASE_INSENSITIVE);
    private static final Pattern API_PATH_PATTERN =
            Pattern.compile("api|route|controller", Pattern.CASE_INSENSITIVE);

    private final TrustPolicy trustPolicy;

    public RiskAssessor(TrustPolicy trustPolicy) {
        this.trustPolicy = trustPolicy;
    }

    /**
     * Perform a full assessment, including the policy flags for the context's trust rank.
     *
     * @param category optional category; null means no category-specific escalation
     */
    public RiskAssessmentResult assess(TaskContext context, List<ProposedAction> actions, ApprovalCategory category) {
        List<RiskFactor> factors = List.of(
                assessFileImpact(actions),
                assessSecurityImpact(context, actions),
                assessReversibility(actions),
                assessDependencyImpact(actions),
                assessDatabaseImpact(actions),
                assessApiImpact(actions)
        );

        double overallScore = weightedScore(factors);
        RiskLevel overallRisk = RiskLevel.fromScore(overallScore);

        boolean requiresApproval = trustPolicy.requiresApproval(overallRisk, context.trustRank(), category);
        boolean autoApprovalEligible = trustPolicy.autoApprovalEligible(overallRisk, factors, context.trustRank());

        return new RiskAssessmentResult(
                overallRisk,
                overallScore,
                factors,
                recommendations(factors, overallRisk),
                requiresApproval,
                autoApprovalEligible);
    }

    /**
     * Weighted sum over all factors. Non-decreasing in each sub-score since weights are positive.
     */
    public static double weightedScore(List<RiskFactor> factors) {
        double total = 0.0;
        for (RiskFactor factor : factors) {
            total += factor.weightedScore();
        }
        return total;
    }

    RiskFactor assessFileImpact(List<ProposedAction> actions) {
        List<String> files = allPaths(actions);
        long criticalFiles = files.stream().filter(RiskAssessor::isCriticalFile).count();

        double score = Math.min(files.size() * 0.2, 3.0);
        score += criticalFiles * CRITICAL_FILE_SCORE;

        return factor(RiskFactor.FILE_IMPACT, score, FILE_COUNT_WEIGHT + CRITICAL_FILES_WEIGHT,
                String.format("Modifying %d files (%d critical)", files.size(), criticalFiles));
    }

    RiskFactor assessSecurityImpact(TaskContext context, List<ProposedAction> actions) {
        double score = 0.0;
        List<String> indicators = new ArrayList<>();

        if (SECURITY_PATTERN.matcher(context.intent()).find()) {
            score += 2.0;
            indicators.add("security-related request");
        }

        long securityActions = actions.stream()
                .filter(a -> SECURITY_PATTERN.matcher(a.description()).find())
                .count();
        if (securityActions > 0) {
            score += securityActions * 1.5;
            indicators.add(securityActions + " security-related actions");
        }

        long securityFiles = allPaths(actions).stream()
                .filter(p -> SECURITY_PATTERN.matcher(p).find())
                .count();
        if (securityFiles > 0) {
            score += securityFiles * SECURITY_PATH_SCORE;
            indicators.add(securityFiles + " security-sensitive files");
        }

        String description = indicators.isEmpty()
                ? "No significant security impact detected"
                : "Security-sensitive changes detected: " + String.join(", ", indicators);
        return factor(RiskFactor.SECURITY_IMPACT, score, SECURITY_WEIGHT, description);
    }

    RiskFactor assessReversibility(List<ProposedAction> actions) {
        long irreversible = actions.stream().filter(a -> !a.reversible()).count();
        return factor(RiskFactor.REVERSIBILITY, irreversible * 2.0, REVERSIBILITY_WEIGHT,
                irreversible + " irreversible actions");
    }

    RiskFactor assessDependencyImpact(List<ProposedAction> actions) {
        long manifests = allPaths(actions).stream()
                .filter(p -> DEPENDENCY_MANIFEST_PATTERN.matcher(p).find())
                .count();
        return factor(RiskFactor.DEPENDENCY_CHANGES, manifests * 1.5, DEPENDENCY_WEIGHT,
                manifests + " dependency files affected");
    }

    RiskFactor assessDatabaseImpact(List<ProposedAction> actions) {
        long databaseActions = actions.stream()
                .filter(a -> DATABASE_DESCRIPTION_PATTERN.matcher(a.description()).find()
                        || a.affectedPaths().stream().anyMatch(p -> DATABASE_PATH_PATTERN.matcher(p).find()))
                .count();
        return factor(RiskFactor.DATABASE_IMPACT, databaseActions * 3.0, DATABASE_WEIGHT,
                databaseActions + " database-related changes");
    }

    RiskFactor assessApiImpact(List<ProposedAction> actions) {
        long apiActions = actions.stream()
                .filter(a -> API_DESCRIPTION_PATTERN.matcher(a.description()).find()
                        || a.affectedPaths().stream().anyMatch(p -> API_PATH_PATTERN.matcher(p).find()))
                .count();
        return factor(RiskFactor.API_IMPACT, apiActions * 2.0, API_WEIGHT,
                apiActions + " API-related changes");
    }

    /**
     * Actionable advice for the overall level plus each factor at high or critical, deduplicated.
     */
    List<String> recommendations(List<RiskFactor> factors, RiskLevel overallRisk) {
        Set<String> recommendations = new LinkedHashSet<>();

        switch (overallRisk) {
            case CRITICAL -> {
                recommendations.add("Consider breaking this into smaller, safer changes");
                recommendations.add("Perform comprehensive testing in staging environment");
                recommendations.add("Prepare rollback plan before proceeding");
            }
            case HIGH -> {
                recommendations.add("Test thoroughly before deployment");
                recommendations.add("Consider phased rollout approach");
            }
            case MEDIUM -> recommendations.add("Add regression tests for affected components");
            case LOW -> { }
        }

        for (RiskFactor factor : factors) {
            if (!factor.level().isAtLeast(RiskLevel.HIGH)) {
                continue;
            }
            switch (factor.category()) {
                case RiskFactor.SECURITY_IMPACT -> {
                    recommendations.add("Perform security review before implementation");
                    recommendations.add("Validate all input and sanitize outputs");
                }
                case RiskFactor.DATABASE_IMPACT -> {
                    recommendations.add("Create database backup before applying changes");
                    recommendations.add("Test migration scripts in development environment");
                }
                case RiskFactor.API_IMPACT -> {
                    recommendations.add("Maintain backward compatibility when possible");
                    recommendations.add("Update API documentation and client libraries");
                }
                case RiskFactor.FILE_IMPACT -> recommendations.add("Review all critical file changes carefully");
                default -> { }
            }
        }

        return List.copyOf(recommendations);
    }

    public static String explain(RiskLevel riskLevel) {
        return switch (riskLevel) {
            case LOW -> "Low risk - minimal impact, easily reversible changes";
            case MEDIUM -> "Medium risk - moderate impact, requires testing";
            case HIGH -> "High risk - significant impact, requires careful review";
            case CRITICAL -> "Critical risk - major impact, requires thorough planning and approval";
        };
    }

    private static RiskFactor factor(String category, double score, double weight, String description) {
        return new RiskFactor(category, score, RiskLevel.fromScore(score), weight, description);
    }

    private static List<String> allPaths(List<ProposedAction> actions) {
        return actions.stream().flatMap(a -> a.affectedPaths().stream()).toList();
    }

    private static boolean isCriticalFile(String path) {
        for (Pattern pattern : CRITICAL_FILE_PATTERNS) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }
}
