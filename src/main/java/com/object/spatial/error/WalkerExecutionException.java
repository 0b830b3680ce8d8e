package com.object.spatial.error;

import com.object.spatial.core.model.ElementId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised out of a spawn when an ability or visit filter failed mid-traversal.
 * Carries the reports and path gathered before the failure; the original
 * exception is the cause.
 */
public class WalkerExecutionException extends ObjectSpatialException {

    private final String walkerId;
    private final List<Object> reports;
    private final List<ElementId> path;

    public WalkerExecutionException(String walkerId, List<Object> reports, List<ElementId> path, Throwable cause) {
        super("Walker " + walkerId + " failed: " + cause.getMessage(), cause);
        this.walkerId = walkerId;
        this.reports = Collections.unmodifiableList(new ArrayList<>(reports));
        this.path = List.copyOf(path);
    }

    public String getWalkerId() {
        return walkerId;
    }

    public List<Object> getReports() {
        return reports;
    }

    public List<ElementId> getPath() {
        return path;
    }
}
