package com.purchasingpower.timegraph.exception;

import java.util.Map;

/**
 * A zone-aware and a zone-naive value reached a comparison without passing through the
 * normalizer. Always a defect in the caller, never something to recover from silently.
 */
public class IncomparableTimestampException extends TemporalGraphException {

    public IncomparableTimestampException(Object left, Object right) {
        super(ErrorCode.INCOMPARABLE_TIMESTAMP,
                "Cannot compare zone-aware and zone-naive timestamps: " + left + " vs " + right,
                Map.of("left", String.valueOf(left), "right", String.valueOf(right)));
    }
}
