package uk.gegc.interviewledger.features.scoring.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.interviewledger.features.scoring.domain.ConsistencyValidator;
import uk.gegc.interviewledger.features.scoring.domain.ScoringEngine;

@Configuration
public class ScoringConfig {

    @Bean
    public ConsistencyValidator consistencyValidator() {
        return new ConsistencyValidator();
    }

    @Bean
    public ScoringEngine scoringEngine(ConsistencyValidator consistencyValidator) {
        return new ScoringEngine(consistencyValidator);
    }
}
