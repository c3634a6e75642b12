package com.metapharm.phi.infrastructure.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Old and new value of one field changed by an UPDATE.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FieldChange {

    @JsonProperty("old")
    private final Object oldValue;

    @JsonProperty("new")
    private final Object newValue;

    @JsonCreator
    public FieldChange(@JsonProperty("old") Object oldValue, @JsonProperty("new") Object newValue) {
        this.oldValue = oldValue;
        this.newValue = newValue;
    }
}
