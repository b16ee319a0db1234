package com.storefront.authservice.controller;

import com.jayway.jsonpath.JsonPath;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthFlowIntegrationTest {

    private static final String PASSWORD = "Passw0rd!";
    private static final String SUPERADMIN_EMAIL = "root@storefront.test";
    private static final String SUPERADMIN_PASSWORD = "Sup3r!Secret";
    private static final AtomicInteger NEXT_HOST = new AtomicInteger(1);

    @Autowired
    MockMvc mvc;

    // Lockout state is shared across the context, so every test talks from its own address.
    private final String ip = "198.51.100." + NEXT_HOST.getAndIncrement();

    private RequestPostProcessor from(String address) {
        return request -> {
            request.setRemoteAddr(address);
            return request;
        };
    }

    private static String uniqueEmail() {
        return "user-" + UUID.randomUUID() + "@storefront.test";
    }

    private String register(String email) throws Exception {
        MvcResult result = mvc.perform(post("/auth/register").with(from(ip))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"%s","passwordConfirmation":"%s","firstName":"Ada"}
                                """.formatted(email, PASSWORD, PASSWORD)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.user.role").value("user"))
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.user.id");
    }

    private String login(String email, String password) throws Exception {
        MvcResult result = mvc.perform(loginRequest(email, password))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tokenType").value("Bearer"))
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.accessToken");
    }

    private RequestBuilder loginRequest(String email, String password) {
        return post("/auth/login").with(from(ip))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"email":"%s","password":"%s"}
                        """.formatted(email, password));
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    @Test
    void registerLoginAndReadSession() throws Exception {
        String email = uniqueEmail();
        String id = register(email);
        String token = login(email, PASSWORD);

        mvc.perform(get("/auth/me").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authenticated").value(true))
                .andExpect(jsonPath("$.data.user.id").value(id))
                .andExpect(jsonPath("$.data.tokenRole").value("user"))
                .andExpect(jsonPath("$.data.recentLogins", hasSize(1)))
                .andExpect(jsonPath("$.data.recentLogins[0].ipAddress").value(ip));
    }

    @Test
    void duplicateRegistrationConflicts() throws Exception {
        String email = uniqueEmail();
        register(email);

        mvc.perform(post("/auth/register").with(from(ip))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"%s","passwordConfirmation":"%s"}
                                """.formatted(email.toUpperCase(), PASSWORD, PASSWORD)))
                .andExpect(status().isConflict());
    }

    @Test
    void mismatchedConfirmationIsRejected() throws Exception {
        mvc.perform(post("/auth/register").with(from(ip))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"%s","passwordConfirmation":"Other0ne!"}
                                """.formatted(uniqueEmail(), PASSWORD)))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void protectedRouteWithoutTokenIsUnauthenticated() throws Exception {
        mvc.perform(get("/auth/me").with(from(ip)))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, containsString("application/problem+json")))
                .andExpect(jsonPath("$.code").value("NO_TOKEN"))
                .andExpect(jsonPath("$.requiresAuth").value(true));
    }

    @Test
    void garbageTokenIsMalformed() throws Exception {
        mvc.perform(get("/auth/me").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer("not.a.jwt")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN"));
    }

    @Test
    void tokenFromCookieIsAccepted() throws Exception {
        String email = uniqueEmail();
        register(email);
        String token = login(email, PASSWORD);

        mvc.perform(get("/auth/me").with(from(ip)).cookie(new Cookie("token", token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.user.email").value(email));
    }

    @Test
    void logoutRevokesTheToken() throws Exception {
        String email = uniqueEmail();
        register(email);
        String token = login(email, PASSWORD);

        mvc.perform(post("/auth/logout").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));

        // Same token again: already revoked, still a clean logout.
        mvc.perform(post("/auth/logout").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true));

        mvc.perform(get("/auth/me").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_REVOKED"));

        // A fresh login is unaffected.
        String next = login(email, PASSWORD);
        mvc.perform(get("/auth/me").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(next)))
                .andExpect(status().isOk());
    }

    @Test
    void logoutWithoutTokenStillSucceeds() throws Exception {
        mvc.perform(post("/auth/logout").with(from(ip)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));
    }

    @Test
    void logoutRevokesCookieToken() throws Exception {
        String email = uniqueEmail();
        register(email);
        String token = login(email, PASSWORD);

        mvc.perform(post("/auth/logout").with(from(ip)).cookie(new Cookie("token", token)))
                .andExpect(status().isOk());

        mvc.perform(get("/auth/me").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_REVOKED"));
    }

    @Test
    void repeatedFailedLoginsBlockTheSource() throws Exception {
        String email = uniqueEmail();
        register(email);

        // Spread over unknown emails so the account lockout does not fire first.
        for (int i = 0; i < 10; i++) {
            mvc.perform(loginRequest(uniqueEmail(), "Wrong0ne!"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
        }

        mvc.perform(loginRequest(email, PASSWORD))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("IP_BLOCKED"))
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
                .andExpect(jsonPath("$.blockedUntil").exists());
    }

    @Test
    void successfulLoginClearsSourceFailures() throws Exception {
        String email = uniqueEmail();
        register(email);

        for (int i = 0; i < 9; i++) {
            mvc.perform(loginRequest(uniqueEmail(), "Wrong0ne!")).andExpect(status().isUnauthorized());
        }
        login(email, PASSWORD);
        for (int i = 0; i < 9; i++) {
            mvc.perform(loginRequest(uniqueEmail(), "Wrong0ne!")).andExpect(status().isUnauthorized());
        }
        login(email, PASSWORD);
    }

    @Test
    void accountLocksAfterRepeatedWrongPasswords() throws Exception {
        String email = uniqueEmail();
        String id = register(email);

        for (int i = 0; i < 5; i++) {
            mvc.perform(loginRequest(email, "Wrong0ne!")).andExpect(status().isUnauthorized());
        }

        // A wrong password on a locked account looks like any other bad credential.
        mvc.perform(loginRequest(email, "Wrong0ne!"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));

        mvc.perform(loginRequest(email, PASSWORD))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("ACCOUNT_LOCKED"))
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER));

        String admin = login(SUPERADMIN_EMAIL, SUPERADMIN_PASSWORD);
        mvc.perform(post("/api/admin/users/{id}/unlock", id).with(from(ip))
                        .header(HttpHeaders.AUTHORIZATION, bearer(admin)))
                .andExpect(status().isOk());

        login(email, PASSWORD);
    }

    @Test
    void roleChangeTakesEffectAfterNextLogin() throws Exception {
        String email = uniqueEmail();
        String id = register(email);
        String userToken = login(email, PASSWORD);

        mvc.perform(get("/api/admin/users").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(userToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_ROLE"));

        String root = login(SUPERADMIN_EMAIL, SUPERADMIN_PASSWORD);
        mvc.perform(patch("/api/admin/users/{id}/role", id).with(from(ip))
                        .header(HttpHeaders.AUTHORIZATION, bearer(root))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role":"admin"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.role").value("admin"));

        // The old token still carries the USER snapshot.
        mvc.perform(get("/api/admin/users").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(userToken)))
                .andExpect(status().isForbidden());

        String adminToken = login(email, PASSWORD);
        mvc.perform(get("/api/admin/users").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.totalItems").exists());

        // Role changes stay with the superadmin.
        mvc.perform(patch("/api/admin/users/{id}/role", id).with(from(ip))
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role":"superadmin"}
                                """))
                .andExpect(status().isForbidden());
    }

    @Test
    void deactivatedAccountIsRefusedWithExistingToken() throws Exception {
        String email = uniqueEmail();
        String id = register(email);
        String token = login(email, PASSWORD);
        String root = login(SUPERADMIN_EMAIL, SUPERADMIN_PASSWORD);

        mvc.perform(patch("/api/admin/users/{id}/status", id).with(from(ip))
                        .header(HttpHeaders.AUTHORIZATION, bearer(root))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"active":false}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.active").value(false));

        mvc.perform(get("/auth/me").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ACCOUNT_DEACTIVATED"));

        mvc.perform(loginRequest(email, PASSWORD))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ACCOUNT_DEACTIVATED"));
    }

    @Test
    void publicSessionNeverFailsOnBadToken() throws Exception {
        mvc.perform(get("/public/session").with(from(ip)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authenticated").value(false));

        mvc.perform(get("/public/session").with(from(ip)).header(HttpHeaders.AUTHORIZATION, bearer("garbage")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authenticated").value(false));

        String email = uniqueEmail();
        register(email);
        String token = login(email, PASSWORD);
        MvcResult result = mvc.perform(get("/public/session").with(from(ip))
                        .header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.authenticated").value(true))
                .andReturn();
        assertThat(result.getResponse().getContentAsString()).doesNotContain("recentLogins");
    }
}
