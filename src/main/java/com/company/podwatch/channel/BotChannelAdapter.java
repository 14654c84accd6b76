package com.company.podwatch.channel;

import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.settings.HttpChannelTransport;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Component
public class BotChannelAdapter extends AbstractHttpChannelAdapter {

    public BotChannelAdapter(@Qualifier("channelRestTemplate") RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    public ChannelType getChannelType() {
        return ChannelType.BOT;
    }

    @Override
    protected Map<String, Object> buildPayload(AlertDestination destination, AlertMessage message,
                                               HttpChannelTransport transport) {
        return Map.of("chatId", destination.getAddress(), "text", message.asText());
    }
}
