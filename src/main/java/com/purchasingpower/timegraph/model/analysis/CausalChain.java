package com.purchasingpower.timegraph.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered document ids linked head to tail by causal relationships.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CausalChain {

    private List<String> documentIds = new ArrayList<>();

    public static CausalChain of(List<String> documentIds) {
        return new CausalChain(List.copyOf(documentIds));
    }

    @JsonIgnore
    public String getHead() {
        return documentIds.get(0);
    }

    @JsonIgnore
    public String getTail() {
        return documentIds.get(documentIds.size() - 1);
    }

    @JsonIgnore
    public int getLength() {
        return documentIds.size();
    }

    /**
     * True when this chain's ids appear, in order and contiguously, inside {@code other}.
     */
    public boolean isContainedIn(CausalChain other) {
        return other.documentIds.size() >= documentIds.size()
                && Collections.indexOfSubList(other.documentIds, documentIds) >= 0;
    }

    @Override
    public String toString() {
        return String.join(" -> ", documentIds);
    }
}
