package com.purchasingpower.timegraph.model.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A causal chain that ends before a window boundary while its tail still has causal successors
 * further in time. Resolved once a later window extends the chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenQuestion {

    /** Last document of the unresolved chain. */
    private String documentId;

    private List<String> chain;

    /** Causal successors of the tail that lie after the window that raised the question. */
    private List<String> pendingDocumentIds;

    private String text;

    private int raisedInWindow;
}
