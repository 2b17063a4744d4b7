package io.practicedb.core.validation;

public enum OnDelete {
    /** Block the delete while references exist. */
    RESTRICT,
    /** Delete the referencing documents too. */
    CASCADE,
    /** Null out the referencing field. */
    SET_NULL
}
