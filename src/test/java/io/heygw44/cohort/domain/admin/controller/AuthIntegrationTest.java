package io.heygw44.cohort.domain.admin.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.heygw44.cohort.domain.admin.dto.LoginRequest;
import io.heygw44.cohort.domain.admin.entity.Admin;
import io.heygw44.cohort.domain.admin.repository.AdminRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("local")
@Transactional
class AuthIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AdminRepository adminRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @BeforeEach
    void setUp() {
        adminRepository.save(Admin.create("staff@example.com", passwordEncoder.encode("password123"), "운영자"));
    }

    private MvcResult login(String email, String password) throws Exception {
        LoginRequest request = new LoginRequest(email, password);
        return mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andReturn();
    }

    @Nested
    @DisplayName("운영자 로그인")
    class LoginSessionTest {

        @Test
        @DisplayName("로그인 성공 시 세션으로 /api/auth/me 조회 가능")
        void login_success_canAccessMe() throws Exception {
            MvcResult loginResult = mockMvc.perform(post("/api/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(
                                    new LoginRequest("staff@example.com", "password123"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.email").value("staff@example.com"))
                    .andReturn();

            MockHttpSession session = (MockHttpSession) loginResult.getRequest().getSession(false);
            assertThat(session).isNotNull();

            mockMvc.perform(get("/api/auth/me")
                            .session(session))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.name").value("운영자"));
        }

        @Test
        @DisplayName("재로그인 시 세션 ID가 바뀐다")
        void login_regeneratesSession() throws Exception {
            MvcResult firstLogin = login("staff@example.com", "password123");
            String firstSessionId = firstLogin.getRequest().getSession().getId();

            mockMvc.perform(post("/api/auth/logout")
                            .session((MockHttpSession) firstLogin.getRequest().getSession())
                            .with(csrf()))
                    .andExpect(status().isOk());

            MvcResult secondLogin = login("staff@example.com", "password123");
            String secondSessionId = secondLogin.getRequest().getSession().getId();

            assertThat(secondSessionId).isNotEqualTo(firstSessionId);
        }
    }

    @Nested
    @DisplayName("세션 없는 접근")
    class UnauthorizedAccessTest {

        @Test
        @DisplayName("세션 없이 /api/auth/me 호출 시 401")
        void me_withoutSession_returns401() throws Exception {
            mockMvc.perform(get("/api/auth/me"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("세션 없이 운영자 API 호출 시 401")
        void adminApi_withoutSession_returns401() throws Exception {
            mockMvc.perform(get("/api/admin/classes/1/capacity"))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("CSRF 보호")
    class CsrfProtectionTest {

        @Test
        @DisplayName("CSRF 토큰 없이 로그아웃 요청 시 403")
        void logout_withoutCsrf_returns403() throws Exception {
            MockHttpSession session = (MockHttpSession) login("staff@example.com", "password123")
                    .getRequest().getSession();

            mockMvc.perform(post("/api/auth/logout")
                            .session(session))
                    .andExpect(status().isForbidden());
        }
    }

    @Nested
    @DisplayName("잘못된 자격증명")
    class InvalidCredentialsTest {

        @Test
        @DisplayName("존재하지 않는 이메일 → AUTH-401-CREDENTIALS")
        void login_withUnknownEmail_returns401() throws Exception {
            mockMvc.perform(post("/api/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(
                                    new LoginRequest("nobody@example.com", "password123"))))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("AUTH-401-CREDENTIALS"));
        }

        @Test
        @DisplayName("잘못된 비밀번호 → AUTH-401-CREDENTIALS")
        void login_withWrongPassword_returns401() throws Exception {
            mockMvc.perform(post("/api/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(
                                    new LoginRequest("staff@example.com", "wrong-password"))))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("AUTH-401-CREDENTIALS"));
        }
    }
}
