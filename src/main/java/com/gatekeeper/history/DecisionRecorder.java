package com.gatekeeper.history;

import com.gatekeeper.core.events.EventBus;
import com.gatekeeper.core.events.EventTypes;
import com.gatekeeper.core.events.GatekeeperEvent;
import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ApprovalRequest;
import com.gatekeeper.core.model.ApprovalResponse;
import com.gatekeeper.core.model.RiskAssessmentResult;
import com.gatekeeper.core.model.RiskLevel;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Commits every resolved approval decision to the current branch of the {@link HistoryStore}.
 * <p>
 * Listens for human responses, timeouts and auto-approvals. Cancelled requests are not recorded.
 */
@Component
public class DecisionRecorder {

    private static final Logger log = LoggerFactory.getLogger(DecisionRecorder.class);

    private static final Set<String> RECORDED_EVENTS = Set.of(
            EventTypes.REQUEST_RESPONDED,
            EventTypes.REQUEST_TIMED_OUT,
            EventTypes.AUTO_APPROVAL);

    private final EventBus eventBus;
    private final HistoryStore historyStore;
    private final HistoryProperties properties;

    private EventBus.Subscription subscription;

    public DecisionRecorder(EventBus eventBus, HistoryStore historyStore, HistoryProperties properties) {
        this.eventBus = eventBus;
        this.historyStore = historyStore;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        if (!properties.isRecordDecisions()) {
            log.info("Decision recording disabled");
            return;
        }
        subscription = eventBus.subscribeAll(this::onEvent);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    void onEvent(GatekeeperEvent event) {
        if (!RECORDED_EVENTS.contains(event.eventType())) {
            return;
        }
        ApprovalResponse response = event.get("response", ApprovalResponse.class);
        if (response == null) {
            return;
        }

        RiskLevel riskLevel = null;
        ApprovalCategory category = null;
        ApprovalRequest request = event.get("request", ApprovalRequest.class);
        if (request != null) {
            riskLevel = request.riskLevel();
            category = request.category();
        } else {
            RiskAssessmentResult assessment = event.get("assessment", RiskAssessmentResult.class);
            if (assessment != null) {
                riskLevel = assessment.overallRisk();
            }
            category = event.get("category", ApprovalCategory.class);
        }

        historyStore.createCommit(response, null, null, riskLevel, category);
    }
}
