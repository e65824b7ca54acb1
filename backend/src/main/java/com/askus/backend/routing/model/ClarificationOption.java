package com.askus.backend.routing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClarificationOption(String label, String value, String description) {

    public static final String OTHER_LABEL = "None of these (type more details)";

    public ClarificationOption(String label, String value) {
        this(label, value, null);
    }

    public static ClarificationOption other() {
        return new ClarificationOption(OTHER_LABEL, Query.OTHER);
    }

    @JsonIgnore
    public boolean isOther() {
        return Query.OTHER.equals(value);
    }
}
