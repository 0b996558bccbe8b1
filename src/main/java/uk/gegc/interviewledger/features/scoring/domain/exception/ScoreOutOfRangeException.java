package uk.gegc.interviewledger.features.scoring.domain.exception;

import lombok.Getter;
import uk.gegc.interviewledger.shared.exception.ErrorCode;
import uk.gegc.interviewledger.shared.exception.LedgerException;

import java.util.HashMap;
import java.util.Map;

@Getter
public class ScoreOutOfRangeException extends LedgerException {

    private final String metric;
    private final Double value;

    public ScoreOutOfRangeException(String metric, Double value) {
        super(ErrorCode.OUT_OF_RANGE, value == null
                ? "Sub-score '" + metric + "' is missing"
                : "Sub-score '" + metric + "' must be within [0, 100] but was " + value);
        this.metric = metric;
        this.value = value;
    }

    @Override
    public Map<String, Object> getProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put("metric", metric);
        props.put("missing", value == null);
        return props;
    }
}
