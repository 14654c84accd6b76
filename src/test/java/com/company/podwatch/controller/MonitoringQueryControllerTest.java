package com.company.podwatch.controller;

import com.company.podwatch.config.SecurityConfig;
import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.MetricSample;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.enums.ChangeType;
import com.company.podwatch.domain.enums.ResourceKind;
import com.company.podwatch.dto.response.ResourceStatusResponse;
import com.company.podwatch.service.MonitoringQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MonitoringQueryController.class)
@Import({SecurityConfig.class, MonitoringQueryControllerTest.MetricsTestConfig.class})
@DisplayName("MonitoringQueryController")
class MonitoringQueryControllerTest {

    @TestConfiguration
    static class MetricsTestConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MeterRegistry meterRegistry;

    @MockBean
    private MonitoringQueryService queryService;

    @MockBean
    private JwtDecoder jwtDecoder;

    private static JwtRequestPostProcessor viewer() {
        return jwt().authorities(new SimpleGrantedAuthority("ROLE_PODWATCH_VIEWER"));
    }

    @Test
    @DisplayName("Should return 401 without a token and 403 without a dashboard role")
    void shouldRequireRole() throws Exception {
        mockMvc.perform(get("/api/v1/monitoring/resources"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/api/v1/monitoring/resources").with(jwt()))
                .andExpect(status().isForbidden());

        verifyNoInteractions(queryService);
    }

    @Test
    @DisplayName("Should list current resources with a short private cache")
    void shouldListResources() throws Exception {
        when(queryService.getCurrentSnapshots("default")).thenReturn(List.of(ResourceStatusResponse.builder()
                .kind("POD")
                .namespace("default")
                .name("web-1")
                .status("Running")
                .cpuFormatted("0.25 Cores")
                .isNew(true)
                .build()));

        mockMvc.perform(get("/api/v1/monitoring/resources").param("namespace", "default").with(viewer()))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "max-age=15, private"))
                .andExpect(jsonPath("$[0].name").value("web-1"))
                .andExpect(jsonPath("$[0].cpuFormatted").value("0.25 Cores"));

        assertThat(meterRegistry.counter("api.monitoring.requests", "endpoint", "resources").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should pass change filters through")
    void shouldFilterChanges() throws Exception {
        when(queryService.getRecentChanges(3, "default", null, ChangeType.IMAGE_CHANGE, 10))
                .thenReturn(List.of(ChangeEvent.builder()
                        .kind(ResourceKind.POD)
                        .namespace("default")
                        .name("web-1")
                        .changeType(ChangeType.IMAGE_CHANGE)
                        .oldValue("app:1")
                        .newValue("app:2")
                        .occurredAt(Instant.parse("2024-05-01T10:00:00Z"))
                        .build()));

        mockMvc.perform(get("/api/v1/monitoring/changes").with(viewer())
                        .param("days", "3")
                        .param("namespace", "default")
                        .param("changeType", "IMAGE_CHANGE")
                        .param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].changeType").value("IMAGE_CHANGE"))
                .andExpect(jsonPath("$[0].newValue").value("app:2"));
    }

    @Test
    @DisplayName("Should reject out of range query parameters")
    void shouldRejectOutOfRange() throws Exception {
        mockMvc.perform(get("/api/v1/monitoring/changes").with(viewer()).param("days", "0"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/monitoring/changes").with(viewer()).param("changeType", "EXPLODED"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should look up node samples without a namespace")
    void shouldQueryNodeMetrics() throws Exception {
        ResourceKey node = ResourceKey.node("node-a");
        when(queryService.getMetrics(node, 6)).thenReturn(List.of(MetricSample.builder()
                .kind(ResourceKind.NODE)
                .namespace("")
                .name("node-a")
                .cpuMillicores(1200L)
                .capturedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build()));

        mockMvc.perform(get("/api/v1/monitoring/metrics/node/-/node-a").param("hours", "6").with(viewer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].cpuMillicores").value(1200));

        verify(queryService).getMetrics(node, 6);
    }

    @Test
    @DisplayName("Should return 400 for an unknown resource kind")
    void shouldRejectUnknownKind() throws Exception {
        mockMvc.perform(get("/api/v1/monitoring/metrics/deployment/default/web").with(viewer()))
                .andExpect(status().isBadRequest());
    }
}
