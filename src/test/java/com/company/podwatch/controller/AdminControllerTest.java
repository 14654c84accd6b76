package com.company.podwatch.controller;

import com.company.podwatch.config.SecurityConfig;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.dto.response.CleanupResponse;
import com.company.podwatch.exception.AdminOperationException;
import com.company.podwatch.exception.InvalidCredentialException;
import com.company.podwatch.exception.ResourceNotFoundException;
import com.company.podwatch.exception.SettingsValidationException;
import com.company.podwatch.service.AdminService;
import com.company.podwatch.settings.SettingsDefaults;
import com.company.podwatch.settings.SettingsMasking;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminController.class)
@Import(SecurityConfig.class)
@DisplayName("AdminController")
class AdminControllerTest {

    private static final String CREDENTIAL = "admin-secret";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AdminService adminService;

    @MockBean
    private JwtDecoder jwtDecoder;

    private static JwtRequestPostProcessor admin() {
        return jwt().jwt(token -> token.subject("ops-1").claim("email", "ops@example.test"))
                .authorities(new SimpleGrantedAuthority("ROLE_PODWATCH_ADMIN"));
    }

    private static JwtRequestPostProcessor viewer() {
        return jwt().authorities(new SimpleGrantedAuthority("ROLE_PODWATCH_VIEWER"));
    }

    @Nested
    @DisplayName("Authentication and authorization")
    class Access {

        @Test
        @DisplayName("Should return 401 without a token")
        void shouldRejectAnonymous() throws Exception {
            mockMvc.perform(get("/api/v1/admin/config"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("Should return 403 for viewers")
        void shouldRejectViewer() throws Exception {
            mockMvc.perform(get("/api/v1/admin/config").with(viewer()))
                    .andExpect(status().isForbidden());

            verifyNoInteractions(adminService);
        }

        @Test
        @DisplayName("Should return 401 when the admin credential header is missing")
        void shouldRequireCredentialHeader() throws Exception {
            mockMvc.perform(post("/api/v1/admin/check-now").with(admin()))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Admin credential required"));

            verifyNoInteractions(adminService);
        }

        @Test
        @DisplayName("Should return 401 when the admin credential is wrong")
        void shouldRejectWrongCredential() throws Exception {
            when(adminService.runCleanup(null, "wrong")).thenThrow(new InvalidCredentialException());

            mockMvc.perform(post("/api/v1/admin/cleanup").with(admin())
                            .header(AdminController.CREDENTIAL_HEADER, "wrong"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.status").value(401));
        }
    }

    @Test
    @DisplayName("Should return masked settings")
    void shouldReturnMaskedSettings() throws Exception {
        when(adminService.getConfig()).thenReturn(SettingsMasking.mask(SettingsDefaults.defaults("$2a$hash")));

        mockMvc.perform(get("/api/v1/admin/config").with(admin()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.monitoring.adminPasswordHash").value(SettingsMasking.MASK))
                .andExpect(jsonPath("$.monitoring.refreshIntervalSeconds").value(600))
                .andExpect(jsonPath("$.alertingSchedule.windows[0].start").value("00:00"));
    }

    @Test
    @DisplayName("Should return 400 with every validation error for invalid settings")
    void shouldRejectInvalidSettings() throws Exception {
        when(adminService.updateConfig(any(), isNull(), eq(CREDENTIAL)))
                .thenThrow(new SettingsValidationException(List.of("monitoring.retentionDays must be at least 1")));

        mockMvc.perform(put("/api/v1/admin/config").with(admin())
                        .header(AdminController.CREDENTIAL_HEADER, CREDENTIAL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"settings\":{\"monitoring\":{\"retentionDays\":0}}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("monitoring.retentionDays must be at least 1"));
    }

    @Nested
    @DisplayName("Restart")
    class Restart {

        @Test
        @DisplayName("Should accept a restart of an existing pod")
        void shouldAcceptRestart() throws Exception {
            mockMvc.perform(post("/api/v1/admin/resources/restart").with(admin())
                            .header(AdminController.CREDENTIAL_HEADER, CREDENTIAL)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"namespace\":\"default\",\"name\":\"web-1\"}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.status").value("restarting"))
                    .andExpect(jsonPath("$.name").value("web-1"));

            verify(adminService).triggerManualRestart(ResourceKey.pod("default", "web-1"), CREDENTIAL);
        }

        @Test
        @DisplayName("Should return 404 for an unknown pod")
        void shouldReturnNotFound() throws Exception {
            doThrow(new ResourceNotFoundException("Pod", "default/ghost"))
                    .when(adminService).triggerManualRestart(ResourceKey.pod("default", "ghost"), CREDENTIAL);

            mockMvc.perform(post("/api/v1/admin/resources/restart").with(admin())
                            .header(AdminController.CREDENTIAL_HEADER, CREDENTIAL)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"namespace\":\"default\",\"name\":\"ghost\"}"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should return 502 when the cluster call fails")
        void shouldReturnBadGateway() throws Exception {
            doThrow(new AdminOperationException("Restart failed: connection refused"))
                    .when(adminService).triggerManualRestart(any(), eq(CREDENTIAL));

            mockMvc.perform(post("/api/v1/admin/resources/restart").with(admin())
                            .header(AdminController.CREDENTIAL_HEADER, CREDENTIAL)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"namespace\":\"default\",\"name\":\"web-1\"}"))
                    .andExpect(status().isBadGateway());
        }

        @Test
        @DisplayName("Should return 400 for a blank pod name")
        void shouldValidateRequest() throws Exception {
            mockMvc.perform(post("/api/v1/admin/resources/restart").with(admin())
                            .header(AdminController.CREDENTIAL_HEADER, CREDENTIAL)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"namespace\":\"default\",\"name\":\"\"}"))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(adminService);
        }
    }

    @Test
    @DisplayName("Should run cleanup with the requested retention")
    void shouldRunCleanup() throws Exception {
        when(adminService.runCleanup(7, CREDENTIAL)).thenReturn(CleanupResponse.builder()
                .retentionDays(7)
                .deleted(Map.of("status_history", 3))
                .totalDeleted(3)
                .build());

        mockMvc.perform(post("/api/v1/admin/cleanup").with(admin())
                        .header(AdminController.CREDENTIAL_HEADER, CREDENTIAL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"retentionDays\":7}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalDeleted").value(3));
    }
}
