package com.company.podwatch.domain;

import com.company.podwatch.domain.enums.ChannelType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Notification endpoint: a mail recipient, a chat account, a phone number or a bot chat
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertDestination implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private ChannelType channelType;
    private String address;
    private boolean enabled;
}
