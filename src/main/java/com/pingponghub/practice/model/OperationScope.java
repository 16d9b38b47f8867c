package com.pingponghub.practice.model;

/**
 * Target of an edit or delete on a session that may belong to a series.
 */
public enum OperationScope {
    SINGLE,
    WHOLE_SERIES
}
