package com.company.podwatch.channel;

import com.company.podwatch.domain.enums.ChannelType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ChannelAdapterRegistry {

    private final Map<ChannelType, ChannelAdapter> adapters = new EnumMap<>(ChannelType.class);

    public ChannelAdapterRegistry(List<ChannelAdapter> adapters) {
        for (ChannelAdapter adapter : adapters) {
            ChannelAdapter previous = this.adapters.put(adapter.getChannelType(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for channel " + adapter.getChannelType());
            }
        }
        log.info("Registered alert channels: {}", this.adapters.keySet());
    }

    public Optional<ChannelAdapter> find(ChannelType channelType) {
        return Optional.ofNullable(adapters.get(channelType));
    }
}
