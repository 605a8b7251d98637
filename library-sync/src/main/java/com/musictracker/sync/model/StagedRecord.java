package com.musictracker.sync.model;

/**
 * An accepted record and the entity built from it, waiting for the next checkpoint.
 */
public record StagedRecord<E>(ExternalRecord source, E entity) {
}
