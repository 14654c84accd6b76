package com.company.podwatch.channel;

import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.settings.HttpChannelTransport;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Messaging API (WhatsApp style): {"phone": ..., "message": ...}
 */
@Component
public class ChatApiChannelAdapter extends AbstractHttpChannelAdapter {

    public ChatApiChannelAdapter(@Qualifier("channelRestTemplate") RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    public ChannelType getChannelType() {
        return ChannelType.CHAT_API;
    }

    @Override
    protected Map<String, Object> buildPayload(AlertDestination destination, AlertMessage message,
                                               HttpChannelTransport transport) {
        return Map.of("phone", destination.getAddress(), "message", message.asText());
    }
}
