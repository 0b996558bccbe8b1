package uk.gegc.interviewledger.features.ledger.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for ledger writes. Fields are placed in the MDC for the duration of a
 * single log call.
 */
public final class LedgerStructuredLogger {

    public static final String ORG_ID = "ledger.orgId";
    public static final String STUDENT_ID = "ledger.studentId";
    public static final String TYPE = "ledger.type";
    public static final String AMOUNT = "ledger.amount";
    public static final String BALANCE_AFTER = "ledger.balanceAfter";
    public static final String INTERVIEW_ID = "ledger.interviewId";
    public static final String STATUS = "ledger.status";

    private LedgerStructuredLogger() {
    }

    /**
     * Log a credit mutation with its resulting balance.
     */
    public static void logCreditMutation(Logger logger, String level, String message,
            UUID orgId, UUID studentId, String type, int amount, int balanceAfter,
            UUID interviewId, Object... additionalArgs) {

        MDC.put(ORG_ID, toString(orgId));
        MDC.put(STUDENT_ID, toString(studentId));
        MDC.put(TYPE, type);
        MDC.put(AMOUNT, String.valueOf(amount));
        MDC.put(BALANCE_AFTER, String.valueOf(balanceAfter));
        MDC.put(INTERVIEW_ID, toString(interviewId));

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearLedgerMDC();
        }
    }

    /**
     * Log an interview lifecycle transition.
     */
    public static void logTransition(Logger logger, String level, String message,
            UUID orgId, UUID interviewId, String status, Object... additionalArgs) {

        MDC.put(ORG_ID, toString(orgId));
        MDC.put(INTERVIEW_ID, toString(interviewId));
        MDC.put(STATUS, status);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearLedgerMDC();
        }
    }

    public static void clearLedgerMDC() {
        MDC.remove(ORG_ID);
        MDC.remove(STUDENT_ID);
        MDC.remove(TYPE);
        MDC.remove(AMOUNT);
        MDC.remove(BALANCE_AFTER);
        MDC.remove(INTERVIEW_ID);
        MDC.remove(STATUS);
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }

    private static String toString(UUID id) {
        return id != null ? id.toString() : null;
    }
}
