package io.practicedb.core.validation;

/**
 * Declared policy for key changes on the referenced side. Document ids are immutable through the
 * engine, so this is recorded but never triggers work.
 */
public enum OnUpdate {
    RESTRICT, CASCADE
}
