package com.object.spatial.spawn;

import com.object.spatial.core.model.ElementId;
import com.object.spatial.walker.WalkerOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one spawn: reports in emission order and every element entered, in order.
 */
public record SpawnResult(String walkerId, List<Object> reports, List<ElementId> path, WalkerOutcome outcome) {

    public SpawnResult {
        // reports may legitimately contain nulls
        reports = Collections.unmodifiableList(new ArrayList<>(reports));
        path = List.copyOf(path);
    }

    public boolean isDisengaged() {
        return outcome == WalkerOutcome.DISENGAGED;
    }
}
