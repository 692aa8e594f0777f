package com.p14n.pubsub.data;

/**
 * How a batch accumulator handles a message arriving from the broker.
 */
public enum DispatchMode {

    /**
     * Append on the delivering thread. Buffer order equals arrival order.
     */
    SYNCHRONOUS,

    /**
     * Submit each arrival to the executor as its own task. Two messages arriving
     * close together may be buffered in either order.
     */
    CONCURRENT
}
