package com.roomrelay.security;

import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.mockUser;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.springSecurity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(properties = {
        "relay.security.bcrypt-strength=4",
        "relay.directory.token=security-test-token"
})
class SecurityConfigTest {

    @Autowired
    private ApplicationContext context;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToApplicationContext(context)
                .apply(springSecurity())
                .configureClient()
                .build();
    }

    @Test
    void authenticatedUserIsStillDeniedOutsideOpenPaths() {
        webTestClient.mutateWith(mockUser("admin").roles("ADMIN"))
                .get().uri("/actuator/env")
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    void authenticationDoesNotReplaceDirectoryToken() {
        webTestClient.mutateWith(mockUser())
                .get().uri("/rooms")
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void directoryTokenIsEnoughWithoutAuthentication() {
        webTestClient.get().uri("/rooms?token=security-test-token")
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void anonymousRequestOutsideOpenPathsIsRejected() {
        webTestClient.get().uri("/admin")
                .exchange()
                .expectStatus().is4xxClientError();
    }

    @Test
    void postToDirectoryIsRejected() {
        webTestClient.mutateWith(mockUser())
                .post().uri("/rooms?token=security-test-token")
                .exchange()
                .expectStatus().isForbidden();
    }
}
