package io.quotecache.config;

/**
 * What a caller does when another execution holds the partition lease.
 */
public enum AdmissionPolicy {
    /** Wait for the lease; retry the whole lookup a bounded number of times before giving up. */
    BLOCKING,
    /** Never wait: serve whatever the store holds, possibly nothing. */
    NON_BLOCKING
}
