package com.company.podwatch.channel;

import com.company.podwatch.exception.ChannelDeliveryException;

import java.util.function.Predicate;

/**
 * Retry predicate for the {@code channelDelivery} retry instance: only transient delivery failures are retried
 */
public class TransientDeliveryPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof ChannelDeliveryException e && e.isTransientFailure();
    }
}
