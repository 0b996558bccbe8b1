package uk.gegc.interviewledger.features.interview.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Interview lifecycle configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "interview")
@Validated
@Data
public class InterviewProperties {

    /**
     * Age after which an in-progress interview without a report is considered abandoned.
     */
    @NotNull
    private Duration stalenessWindow = Duration.ofHours(2);

    /**
     * Route used when neither the request nor the student names one.
     */
    @NotBlank
    private String defaultRoute = "usa_f1";

    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Reconciliation {
        /**
         * Cron for the stuck-interview sweep; "-" disables it.
         */
        @NotBlank
        private String cron = "0 0 * * * *";
    }
}
