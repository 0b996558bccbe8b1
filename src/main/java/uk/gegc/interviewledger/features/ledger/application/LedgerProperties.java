package uk.gegc.interviewledger.features.ledger.application;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Ledger configuration (transaction retries and history paging).
 */
@Configuration
@ConfigurationProperties(prefix = "ledger")
@Validated
@Data
public class LedgerProperties {

    /**
     * Total attempts for one optimistic transaction before surfacing a conflict.
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * Number of history entries returned with a credit summary.
     */
    @Positive
    private int historyPageSize = 50;

    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Reconciliation {
        /**
         * Cron for the credit ledger reconciliation job; "-" disables it.
         */
        @NotBlank
        private String cron = "0 0 2 * * SUN";
    }
}
