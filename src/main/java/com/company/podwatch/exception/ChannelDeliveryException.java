package com.company.podwatch.exception;

import com.company.podwatch.domain.enums.ChannelType;

/**
 * A single send attempt failed. Transient failures are retried, permanent ones are not.
 */
public class ChannelDeliveryException extends RuntimeException {

    private final ChannelType channelType;
    private final boolean transientFailure;

    public ChannelDeliveryException(ChannelType channelType, String message, boolean transientFailure) {
        super(message);
        this.channelType = channelType;
        this.transientFailure = transientFailure;
    }

    public ChannelDeliveryException(ChannelType channelType, String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.channelType = channelType;
        this.transientFailure = transientFailure;
    }

    public ChannelType getChannelType() {
        return channelType;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
