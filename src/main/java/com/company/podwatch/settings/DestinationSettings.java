package com.company.podwatch.settings;

import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.enums.ChannelType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DestinationSettings {
    private EmailTransport email;
    private HttpChannelTransport chatApi;
    private HttpChannelTransport sms;
    private HttpChannelTransport bot;

    private List<AlertDestination> targets;

    @JsonIgnore
    public List<AlertDestination> getEnabledTargets() {
        if (targets == null) {
            return List.of();
        }
        return targets.stream().filter(AlertDestination::isEnabled).toList();
    }

    public Optional<AlertDestination> findTarget(String destinationId) {
        if (targets == null) {
            return Optional.empty();
        }
        return targets.stream().filter(t -> destinationId.equals(t.getId())).findFirst();
    }

    public HttpChannelTransport httpTransport(ChannelType channelType) {
        return switch (channelType) {
            case CHAT_API -> chatApi;
            case SMS -> sms;
            case BOT -> bot;
            case EMAIL -> throw new IllegalArgumentException("Email is not an HTTP channel");
        };
    }
}
