package com.datasync.personconsumer.listener;

/**
 * Terminal state of one delivery.
 */
public enum DeliveryOutcome {

    /** Written to the table and acknowledged. */
    ACKED,

    /** Not written; removed from the queue without requeue. */
    REJECTED
}
