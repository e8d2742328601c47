package io.github.yok.credload.db;

/**
 * What an upsert does when the identifier already exists.
 */
public enum ConflictAction {

    /** Overwrite the variant's value columns with the incoming values. */
    UPDATE,

    /** Keep the existing record. */
    DO_NOTHING
}
