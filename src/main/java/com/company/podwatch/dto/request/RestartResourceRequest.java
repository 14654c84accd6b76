package com.company.podwatch.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestartResourceRequest {
    @NotBlank(message = "Namespace is required")
    private String namespace;

    @NotBlank(message = "Pod name is required")
    private String name;
}
