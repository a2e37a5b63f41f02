package com.purchasingpower.timegraph.exception;

import java.util.Map;

/** No directed route exists between two documents within the hop bound. */
public class NoPathException extends TemporalGraphException {

    public NoPathException(String fromId, String toId, int maxHops) {
        super(ErrorCode.NO_PATH,
                "No path from " + fromId + " to " + toId + " within " + maxHops + " hops",
                Map.of("from", fromId, "to", toId, "maxHops", maxHops));
    }
}
