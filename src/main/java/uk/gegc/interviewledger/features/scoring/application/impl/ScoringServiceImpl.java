package uk.gegc.interviewledger.features.scoring.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.interviewledger.features.ledger.application.LedgerMetricsService;
import uk.gegc.interviewledger.features.scoring.application.ScoringProfileRegistry;
import uk.gegc.interviewledger.features.scoring.application.ScoringService;
import uk.gegc.interviewledger.features.scoring.domain.ScoringEngine;
import uk.gegc.interviewledger.features.scoring.domain.model.AnswerInput;
import uk.gegc.interviewledger.features.scoring.domain.model.ConsistencyWarning;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoringProfile;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringServiceImpl implements ScoringService {

    private final ScoringProfileRegistry profileRegistry;
    private final ScoringEngine scoringEngine;
    private final LedgerMetricsService metricsService;

    @Override
    public ScoreReport score(String route, List<AnswerInput> answers, Double holisticScore, boolean bodyEnabled) {
        ScoringProfile profile = profileRegistry.forRoute(route);
        ScoreReport report = scoringEngine.evaluate(profile, answers, holisticScore, bodyEnabled);

        for (ConsistencyWarning warning : report.consistencyWarnings()) {
            metricsService.incrementConsistencyWarning(warning.type().name());
            log.warn("Scoring drift on route {}: {} (per-answer mean {}, holistic {}, discrepancy {})",
                    route, warning.type(), warning.perAnswerMean(), warning.holisticScore(), warning.discrepancy());
        }
        log.debug("Scored {} answers with profile {}: overall={}, decision={}",
                answers.size(), profile.name(), report.overall(), report.decision());
        return report;
    }
}
