package com.company.podwatch.channel;

import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.settings.HttpChannelTransport;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

@Component
public class SmsChannelAdapter extends AbstractHttpChannelAdapter {

    // three concatenated segments
    static final int MAX_TEXT_LENGTH = 480;

    public SmsChannelAdapter(@Qualifier("channelRestTemplate") RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    public ChannelType getChannelType() {
        return ChannelType.SMS;
    }

    @Override
    protected Map<String, Object> buildPayload(AlertDestination destination, AlertMessage message,
                                               HttpChannelTransport transport) {
        String text = message.asText();
        if (text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH - 3) + "...";
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("to", destination.getAddress());
        payload.put("from", transport.getSender());
        payload.put("text", text);
        return payload;
    }
}
