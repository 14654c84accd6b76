package com.company.podwatch.dto.request;

import com.company.podwatch.settings.PodWatchSettings;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateConfigRequest {
    @NotNull(message = "Settings are required")
    private PodWatchSettings settings;

    // Optional: replaces the admin credential
    @Size(min = 8, message = "Admin password must have at least 8 characters")
    private String newAdminPassword;
}
