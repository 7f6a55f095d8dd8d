package com.congruence.core.ingest;

/**
 * Counts of one ingestion pass.
 *
 * @param contributors contributor snapshots written
 * @param skipped      contributors whose rows failed and were rolled back individually
 * @param files        distinct code files referenced by the written TA entries
 * @param taEntries    TA entries written for the project and branch
 */
public record IngestionResult(int contributors, int skipped, int files, int taEntries) {
}
