package com.company.podwatch.channel;

import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.exception.ChannelDeliveryException;
import com.company.podwatch.settings.DestinationSettings;

/**
 * Delivers one message to one destination over one transport
 */
public interface ChannelAdapter {

    ChannelType getChannelType();

    /**
     * Whether the transport settings needed by this channel are present
     */
    boolean isConfigured(DestinationSettings settings);

    /**
     * Performs a single delivery attempt.
     *
     * @throws ChannelDeliveryException when the attempt fails
     */
    void send(AlertDestination destination, AlertMessage message, DestinationSettings settings);
}
