package com.hwsc.userservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hwsc.userservice.dto.AuthTokenRequest;
import com.hwsc.userservice.dto.CreateUserRequest;
import com.hwsc.userservice.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class UserControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String createUser(String email) throws Exception {
        CreateUserRequest body = CreateUserRequest.builder()
                .firstName("Lisa")
                .lastName("Kim")
                .email(email)
                .password("Whale-song-42")
                .organization("HWSC")
                .build();
        MvcResult result = mockMvc.perform(post("/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.code").value("OK"))
                .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.path("data").path("uuid").asText();
    }

    @Test
    void createThenGetUser() throws Exception {
        String uuid = createUser("lisa@hwsc.org");

        mockMvc.perform(get("/users/{uuid}", uuid))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.uuid").value(uuid))
                .andExpect(jsonPath("$.data.email").value("lisa@hwsc.org"))
                .andExpect(jsonPath("$.data.password").doesNotExist());
    }

    @Test
    void duplicateEmailIsConflictProblem() throws Exception {
        createUser("hwsc.test+user2@gmail.com");

        CreateUserRequest again = CreateUserRequest.builder()
                .firstName("Lisa").lastName("Kim").email("hwsc.test+user2@gmail.com")
                .password("Whale-song-42").organization("HWSC").build();
        mockMvc.perform(post("/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(again)))
                .andExpect(status().isConflict())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(jsonPath("$.code").value("ALREADY_EXISTS"));
    }

    @Test
    void missingFieldsAreInvalidArgument() throws Exception {
        mockMvc.perform(post("/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"lisa@hwsc.org\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void malformedIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/users/{uuid}", "not-a-ulid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void unknownUserIsNotFound() throws Exception {
        mockMvc.perform(delete("/users/{uuid}", "01hxz8k3b3w4v1f6q2n9yjz0ta"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void tokenIssueAndVerifyOverHttp() throws Exception {
        String uuid = createUser("lisa@hwsc.org");
        AuthTokenRequest req = new AuthTokenRequest(uuid, "lisa@hwsc.org", "Whale-song-42");

        MvcResult issued = mockMvc.perform(post("/auth/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.token").isNotEmpty())
                .andExpect(jsonPath("$.data.secret.key").isNotEmpty())
                .andReturn();
        String token = objectMapper.readTree(issued.getResponse().getContentAsString())
                .path("data").path("token").asText();

        mockMvc.perform(post("/auth/token/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + token + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.uuid").value(uuid));

        mockMvc.perform(post("/auth/secrets"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/auth/token/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + token + "\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    void emptyAuthTokenIsNotFound() throws Exception {
        mockMvc.perform(post("/auth/token/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void statusReflectsGate() throws Exception {
        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("AVAILABLE"));

        stateGate.lock();

        mockMvc.perform(get("/status"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("UNAVAILABLE"));
    }

    @Test
    void unexposedPathsAreRefused() throws Exception {
        mockMvc.perform(get("/internal/anything"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }
}
