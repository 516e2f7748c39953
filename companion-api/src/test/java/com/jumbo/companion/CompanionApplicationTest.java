package com.jumbo.companion;

import com.jumbo.companion.persistence.entity.UserProfileEntity;
import com.jumbo.companion.persistence.repository.UserProfileRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class CompanionApplicationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private UserProfileRepository profileRepository;

    @Test
    void answersSadMessageWithPersonalTemplate() {
        profileRepository.save(new UserProfileEntity("flow-user", "Sam", "{}", "{\"Priya\":\"friend\"}"));

        webTestClient.post().uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "flow-user", "sessionId", "s1", "message", "I'm feeling really sad today"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.metadata.strategy").isEqualTo("TEMPLATE")
                .jsonPath("$.metadata.emotion").isEqualTo("SADNESS")
                .jsonPath("$.metadata.templateId").isEqualTo("sad_support_named")
                .jsonPath("$.metadata.storeReads").isEqualTo(2);
    }

    @Test
    void healthEndpointReportsGovernor() {
        webTestClient.get().uri("/actuator/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.components.governor.details.circuit").isEqualTo("closed");
    }
}
