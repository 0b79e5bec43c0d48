package com.gatekeeper.core.risk;

import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ProposedAction;
import com.gatekeeper.core.model.RiskAssessmentResult;
import com.gatekeeper.core.model.RiskFactor;
import com.gatekeeper.core.model.RiskLevel;
import com.gatekeeper.core.model.TaskContext;
import com.gatekeeper.core.model.TrustRank;
import com.gatekeeper.core.policy.TrustPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskAssessorTest {

    private final RiskAssessor assessor = new RiskAssessor(new TrustPolicy());

    private static List<ProposedAction> authUpgrade() {
        return List.of(
                ProposedAction.reversible("edit", "Upgrade auth token library", "package.json"),
                ProposedAction.reversible("edit", "Rotate auth secret settings", "auth/config.ts"));
    }

    @Nested
    @DisplayName("scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("novice touching package.json and auth config needs approval at high risk")
        void noviceAuthChange() {
            TaskContext context = TaskContext.of("update auth token handling", TrustRank.NOVICE);

            for (ApprovalCategory category : new ApprovalCategory[]{null, ApprovalCategory.IMPLEMENTATION,
                    ApprovalCategory.REFACTORING, ApprovalCategory.SECURITY}) {
                RiskAssessmentResult result = assessor.assess(context, authUpgrade(), category);

                assertTrue(result.overallRisk().isAtLeast(RiskLevel.HIGH));
                assertTrue(result.requiresApproval());
                assertFalse(result.autoApprovalEligible());
                assertTrue(result.factor(RiskFactor.FILE_IMPACT).orElseThrow().level().isAtLeast(RiskLevel.MEDIUM));
                assertTrue(result.factor(RiskFactor.SECURITY_IMPACT).orElseThrow().level().isAtLeast(RiskLevel.MEDIUM));
            }
        }

        @Test
        @DisplayName("plain edits to package.json and auth config are high risk on their own")
        void criticalPathsAlone() {
            TaskContext context = TaskContext.of("Update project configuration", TrustRank.NOVICE);
            List<ProposedAction> actions = List.of(
                    ProposedAction.reversible("edit", "Bump version", "package.json"),
                    ProposedAction.reversible("edit", "Change settings", "auth/config.ts"));

            RiskAssessmentResult result = assessor.assess(context, actions, null);

            assertEquals(4.365, result.overallScore(), 0.0001);
            assertEquals(RiskLevel.HIGH, result.overallRisk());
            assertTrue(result.requiresApproval());
            assertEquals(8.4, result.factor(RiskFactor.FILE_IMPACT).orElseThrow().score(), 0.0001);
            assertEquals(4.0, result.factor(RiskFactor.SECURITY_IMPACT).orElseThrow().score(), 0.0001);
            assertEquals(0.0, result.factor(RiskFactor.REVERSIBILITY).orElseThrow().score());
        }

        @Test
        @DisplayName("a single critical file adds more than a single plain file")
        void criticalFileOutweighsPlainFile() {
            double plain = assessor.assessFileImpact(
                    List.of(ProposedAction.reversible("edit", "x", "src/app.ts"))).score();
            double critical = assessor.assessFileImpact(
                    List.of(ProposedAction.reversible("edit", "x", "package.json"))).score();
            assertTrue(critical > plain);
        }

        @Test
        @DisplayName("documentation-only change at learning rank is auto-approvable")
        void learningDocsChange() {
            TaskContext context = TaskContext.of("Fix typo in README", TrustRank.LEARNING);
            RiskAssessmentResult result = assessor.assess(context,
                    List.of(ProposedAction.reversible("edit", "Fix typo in documentation", "docs/README.md")), null);

            assertEquals(RiskLevel.LOW, result.overallRisk());
            assertFalse(result.requiresApproval());
            assertTrue(result.autoApprovalEligible());
            assertTrue(result.recommendations().isEmpty());
        }
    }

    @Nested
    @DisplayName("factors")
    class FactorTests {

        @Test
        @DisplayName("always six factors in a fixed order")
        void sixFactors() {
            RiskAssessmentResult result = assessor.assess(TaskContext.of("x", TrustRank.NOVICE), authUpgrade(), null);
            assertEquals(List.of(RiskFactor.FILE_IMPACT, RiskFactor.SECURITY_IMPACT, RiskFactor.REVERSIBILITY,
                            RiskFactor.DEPENDENCY_CHANGES, RiskFactor.DATABASE_IMPACT, RiskFactor.API_IMPACT),
                    result.factors().stream().map(RiskFactor::category).toList());
        }

        @Test
        @DisplayName("file impact counts files and adds four per critical file")
        void fileImpact() {
            RiskFactor factor = assessor.assessFileImpact(authUpgrade());
            assertEquals(8.4, factor.score(), 0.0001);
            assertEquals(RiskLevel.CRITICAL, factor.level());
            assertEquals(0.35, factor.weight(), 0.0001);
        }

        @Test
        @DisplayName("file count contribution is capped at three")
        void fileCountCap() {
            List<String> paths = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                paths.add("src/file" + i + ".ts");
            }
            RiskFactor factor = assessor.assessFileImpact(
                    List.of(new ProposedAction("edit", "touch many", paths, null, true)));
            assertEquals(3.0, factor.score(), 0.0001);
        }

        @Test
        @DisplayName("security impact sums intent, descriptions and paths")
        void securityImpact() {
            RiskFactor factor = assessor.assessSecurityImpact(
                    TaskContext.of("update auth token handling", TrustRank.NOVICE), authUpgrade());
            assertEquals(9.0, factor.score(), 0.0001);
            assertEquals(RiskLevel.CRITICAL, factor.level());
        }

        @Test
        @DisplayName("database, API and dependency dimensions")
        void otherDimensions() {
            List<ProposedAction> actions = List.of(
                    ProposedAction.reversible("edit", "Add migration for users table", "db/migrations/001.sql"),
                    ProposedAction.reversible("edit", "Add users endpoint", "src/routes/users.ts"),
                    ProposedAction.reversible("edit", "Bump lib", "pom.xml"));

            assertEquals(3.0, assessor.assessDatabaseImpact(actions).score(), 0.0001);
            assertEquals(2.0, assessor.assessApiImpact(actions).score(), 0.0001);
            assertEquals(1.5, assessor.assessDependencyImpact(actions).score(), 0.0001);
            assertEquals(0.0, assessor.assessReversibility(actions).score(), 0.0001);
        }

        @Test
        @DisplayName("zero actions leave file-derived sub-scores at zero")
        void zeroActions() {
            RiskAssessmentResult result = assessor.assess(TaskContext.of("rotate the password", TrustRank.LEARNING),
                    List.of(), null);
            assertEquals(0.0, result.factor(RiskFactor.FILE_IMPACT).orElseThrow().score());
            assertEquals(0.0, result.factor(RiskFactor.DEPENDENCY_CHANGES).orElseThrow().score());
            assertEquals(0.0, result.factor(RiskFactor.DATABASE_IMPACT).orElseThrow().score());
            assertEquals(0.0, result.factor(RiskFactor.API_IMPACT).orElseThrow().score());
            assertEquals(2.0, result.factor(RiskFactor.SECURITY_IMPACT).orElseThrow().score(), 0.0001);
            assertEquals(0.6, result.overallScore(), 0.0001);
        }
    }

    @Nested
    @DisplayName("weighted score")
    class WeightedScoreTests {

        @Test
        @DisplayName("is non-decreasing as any sub-score grows")
        void monotonic() {
            List<RiskFactor> base = assessor.assess(TaskContext.of("x", TrustRank.NOVICE), authUpgrade(), null).factors();
            double baseline = RiskAssessor.weightedScore(base);

            for (int i = 0; i < base.size(); i++) {
                double previous = baseline;
                for (double bump = 0.5; bump <= 5.0; bump += 0.5) {
                    List<RiskFactor> changed = new ArrayList<>(base);
                    RiskFactor f = base.get(i);
                    changed.set(i, new RiskFactor(f.category(), f.score() + bump,
                            RiskLevel.fromScore(f.score() + bump), f.weight(), f.description()));
                    double score = RiskAssessor.weightedScore(changed);
                    assertTrue(score >= previous, f.category() + " bump " + bump);
                    previous = score;
                }
            }
        }

        @Test
        @DisplayName("levels follow the 2/4/6 thresholds")
        void thresholds() {
            assertEquals(RiskLevel.LOW, RiskLevel.fromScore(1.99));
            assertEquals(RiskLevel.MEDIUM, RiskLevel.fromScore(2.0));
            assertEquals(RiskLevel.HIGH, RiskLevel.fromScore(4.0));
            assertEquals(RiskLevel.CRITICAL, RiskLevel.fromScore(6.0));
        }
    }

    @Nested
    @DisplayName("recommendations")
    class RecommendationTests {

        @Test
        @DisplayName("high overall risk and security factor produce deduplicated advice")
        void highRiskAdvice() {
            RiskAssessmentResult result = assessor.assess(
                    TaskContext.of("update auth token handling", TrustRank.NOVICE), authUpgrade(), null);

            assertTrue(result.recommendations().contains("Test thoroughly before deployment"));
            assertTrue(result.recommendations().contains("Perform security review before implementation"));
            assertTrue(result.recommendations().contains("Review all critical file changes carefully"));
            assertEquals(result.recommendations().size(), result.recommendations().stream().distinct().count());
        }

        @Test
        @DisplayName("explain describes every level")
        void explain() {
            for (RiskLevel level : RiskLevel.values()) {
                assertTrue(RiskAssessor.explain(level).toLowerCase().startsWith(level.label()));
            }
        }
    }
}
