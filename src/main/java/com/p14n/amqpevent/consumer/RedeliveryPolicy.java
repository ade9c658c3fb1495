package com.p14n.amqpevent.consumer;

import com.p14n.amqpevent.DeliveryContext;

/**
 * Decides whether a delivery whose handler failed goes back to the queue.
 * Deliveries that are not requeued are rejected, and end up in the
 * dead-letter exchange when the queue has one.
 */
@FunctionalInterface
public interface RedeliveryPolicy {

    /**
     * Requeues every failed delivery, forever.
     */
    RedeliveryPolicy UNLIMITED = context -> true;

    boolean shouldRequeue(DeliveryContext context);

    /**
     * Requeues a failed delivery until it has been delivered
     * {@code maxDeliveries} times.
     *
     * @param maxDeliveries total number of deliveries allowed, at least 1
     * @return the policy
     */
    static RedeliveryPolicy maxDeliveries(int maxDeliveries) {
        if (maxDeliveries < 1) {
            throw new IllegalArgumentException("maxDeliveries must be at least 1");
        }
        // deliveryCount() counts previous deliveries
        return context -> context.deliveryCount() + 1 < maxDeliveries;
    }
}
