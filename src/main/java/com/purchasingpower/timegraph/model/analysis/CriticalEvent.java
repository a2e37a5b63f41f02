package com.purchasingpower.timegraph.model.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriticalEvent {

    private String documentId;
    private Instant timestamp;
    private double importance;

    /** Leading part of the document content. */
    private String summary;

    /** Window in which the event was identified. */
    private int windowIndex;
}
