package com.telcobright.partman.core.enums;

/**
 * Partition DDL operation that a failure record refers to.
 * Each action carries the retry budget given to newly recorded failures.
 */
public enum FailureAction {

    CREATE(20),
    DROP(5),
    TRUNCATE(5);

    private final int defaultMaxRetry;

    FailureAction(int defaultMaxRetry) {
        this.defaultMaxRetry = defaultMaxRetry;
    }

    public int getDefaultMaxRetry() {
        return defaultMaxRetry;
    }

    public static FailureAction forCleanup(CleanupAction cleanupAction) {
        return cleanupAction == CleanupAction.TRUNCATE ? TRUNCATE : DROP;
    }
}
