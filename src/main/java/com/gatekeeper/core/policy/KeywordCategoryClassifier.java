package com.gatekeeper.core.policy;

import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.TaskContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword heuristic that scans the task intent for category indicators.
 * <p>
 * Each pattern that matches adds its weight to its category; the heaviest category wins and
 * the heaviest matching pattern within it names the theme. Matching is case-insensitive.
 */
@Component
public class KeywordCategoryClassifier implements CategoryClassifier {

    private record KeywordPattern(
        ApprovalCategory category,
        String themeId,
        double weight,
        List<String> keywords
    ) {}

    /** Short tokens that would otherwise match inside unrelated words ("api" in "capital"). */
    private static final Set<String> WORD_BOUNDARY_KEYWORDS = Set.of("api", "auth", "code", "jwt", "ssl", "tls", "xss");

    private static final List<KeywordPattern> PATTERNS = List.of(
            new KeywordPattern(ApprovalCategory.ARCHITECTURE, "arch-api-design", 1.0,
                    List.of("api", "endpoint", "route", "architecture", "design")),
            new KeywordPattern(ApprovalCategory.ARCHITECTURE, "arch-database-schema", 1.0,
                    List.of("schema", "database", "migration")),
            new KeywordPattern(ApprovalCategory.ARCHITECTURE, "arch-new-service", 1.2,
                    List.of("new service", "create service", "add service", "service design", "microservice")),
            new KeywordPattern(ApprovalCategory.IMPLEMENTATION, "impl-feature-addition", 0.8,
                    List.of("implement", "add feature", "create function", "build", "develop", "code")),
            new KeywordPattern(ApprovalCategory.IMPLEMENTATION, "impl-bug-fix", 0.6,
                    List.of("bug fix", "fix bug", "resolve issue", "patch", "hotfix", "typo")),
            new KeywordPattern(ApprovalCategory.IMPLEMENTATION, "impl-integration", 1.0,
                    List.of("integrate", "integration", "third party", "external api", "library")),
            new KeywordPattern(ApprovalCategory.REFACTORING, "refactor-code-structure", 0.7,
                    List.of("refactor", "restructure", "cleanup", "reorganize", "improve")),
            new KeywordPattern(ApprovalCategory.REFACTORING, "refactor-dependency-update", 0.9,
                    List.of("update dependencies", "upgrade", "dependency update", "package update")),
            new KeywordPattern(ApprovalCategory.SECURITY, "security-authentication", 1.5,
                    List.of("security", "auth", "authentication", "authorization", "permission", "encrypt", "decrypt")),
            new KeywordPattern(ApprovalCategory.SECURITY, "security-data-protection", 1.4,
                    List.of("password", "token", "jwt", "oauth", "ssl", "tls", "certificate")),
            new KeywordPattern(ApprovalCategory.SECURITY, "security-vulnerability-fix", 1.6,
                    List.of("vulnerability", "security fix", "exploit", "xss", "sql injection")),
            new KeywordPattern(ApprovalCategory.PERFORMANCE, "perf-caching", 0.8,
                    List.of("cache", "caching", "redis", "memcached")),
            new KeywordPattern(ApprovalCategory.PERFORMANCE, "perf-scaling", 1.1,
                    List.of("scale", "scaling", "load balancer")),
            new KeywordPattern(ApprovalCategory.PERFORMANCE, "perf-optimization", 0.9,
                    List.of("performance", "optimize", "speed up", "faster", "bottleneck", "query optimization"))
    );

    @Override
    public CategorySuggestion classify(TaskContext context) {
        String text = context.intent();
        if (text == null || text.isBlank()) {
            return CategorySuggestion.none();
        }
        String lowerText = text.toLowerCase();

        Map<ApprovalCategory, Double> scores = new EnumMap<>(ApprovalCategory.class);
        Map<ApprovalCategory, KeywordPattern> strongest = new EnumMap<>(ApprovalCategory.class);
        List<String> matchedKeywords = new ArrayList<>();
        double totalWeight = 0.0;

        for (KeywordPattern pattern : PATTERNS) {
            List<String> matched = pattern.keywords().stream()
                    .filter(keyword -> matchesKeyword(lowerText, keyword))
                    .toList();
            if (matched.isEmpty()) {
                continue;
            }
            matchedKeywords.addAll(matched);
            scores.merge(pattern.category(), pattern.weight(), Double::sum);
            totalWeight += pattern.weight();
            strongest.merge(pattern.category(), pattern,
                    (current, candidate) -> candidate.weight() > current.weight() ? candidate : current);
        }

        if (scores.isEmpty()) {
            return CategorySuggestion.none();
        }

        // EnumMap iterates in declaration order, so ties resolve deterministically
        ApprovalCategory best = null;
        double bestScore = -1;
        for (var entry : scores.entrySet()) {
            if (entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }

        return new CategorySuggestion(
                Optional.of(best),
                strongest.get(best).themeId(),
                Math.min(1.0, bestScore / totalWeight),
                List.copyOf(matchedKeywords));
    }

    private static boolean matchesKeyword(String lowerText, String keyword) {
        if (WORD_BOUNDARY_KEYWORDS.contains(keyword)) {
            return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b")
                    .matcher(lowerText).find();
        }
        return lowerText.contains(keyword);
    }
}
