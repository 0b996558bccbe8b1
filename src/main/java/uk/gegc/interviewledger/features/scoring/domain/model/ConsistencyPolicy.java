package uk.gegc.interviewledger.features.scoring.domain.model;

/**
 * Thresholds for flagging drift between the per-answer mean and a holistic score.
 *
 * @param warningThreshold   any discrepancy above this raises a drift warning
 * @param maxDiscrepancy     tighter bound applied to high performers
 * @param highPerformerFloor per-answer mean at or above which the tighter bound applies
 */
public record ConsistencyPolicy(double warningThreshold, double maxDiscrepancy, double highPerformerFloor) {

    public static final ConsistencyPolicy DEFAULT = new ConsistencyPolicy(15.0, 10.0, 75.0);
}
