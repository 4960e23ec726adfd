package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Detection strategy that produced a candidate.
 *
 * <p>Declaration order is the tie-break priority when two candidates carry the
 * same confidence: a path match outranks a remote match, which outranks a marker
 * match, which outranks a name mention.
 */
public enum DetectionMethod {
    @JsonProperty("path")
    PATH("path"),

    @JsonProperty("vcs")
    VCS("vcs"),

    @JsonProperty("marker")
    MARKER("marker"),

    @JsonProperty("fuzzyName")
    FUZZY_NAME("fuzzyName");

    private final String id;

    DetectionMethod(String id) {
        this.id = id;
    }

    /**
     * Returns the wire identifier used in audit records and CLI output.
     *
     * @return method id
     */
    public String getId() {
        return id;
    }
}
