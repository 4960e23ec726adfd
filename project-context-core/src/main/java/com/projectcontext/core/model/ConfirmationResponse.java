package com.projectcontext.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer of a human confirmation prompt.
 */
public enum ConfirmationResponse {
    @JsonProperty("yes")
    YES,

    @JsonProperty("no")
    NO,

    @JsonProperty("timeout")
    TIMEOUT
}
