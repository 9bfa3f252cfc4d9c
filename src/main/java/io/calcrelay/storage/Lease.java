package io.calcrelay.storage;

/**
 * Ownership of one calcjob's processing row. Every write made under a lease is
 * fenced by both the token and the epoch that were granted together.
 */
public record Lease(long calcjobPk, String owner, String token, long epoch) {
}
