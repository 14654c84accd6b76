package com.company.podwatch.settings;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailTransport {
    private String smtpHost;
    private Integer smtpPort;
    private String username;
    private String password;
    private String from;
    private Boolean startTls;

    @JsonIgnore
    public boolean isConfigured() {
        return smtpHost != null && !smtpHost.isBlank();
    }
}
