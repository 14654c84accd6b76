package com.company.podwatch.settings;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Transport settings shared by the HTTP based channels (chat API, SMS gateway, bot API)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HttpChannelTransport {
    private String apiUrl;
    private String apiToken;
    // sender id / phone number, used by the SMS gateway
    private String sender;

    @JsonIgnore
    public boolean isConfigured() {
        return apiUrl != null && !apiUrl.isBlank();
    }
}
