package org.example.coach.controller;

import org.example.coach.model.LearnerProfile;
import org.example.coach.service.LearnerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;
import java.util.Set;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LearnerController.class)
class LearnerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LearnerService learnerService;

    @Test
    void getProfile_knownLearner_returnsProfile() throws Exception {
        when(learnerService.getProfile(7L)).thenReturn(Optional.of(
                new LearnerProfile(7L, "@alice", 45, 2, 3, 30, Set.of("phishing_hero"), 38)));

        mockMvc.perform(get("/api/learners/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.displayName", is("@alice")))
                .andExpect(jsonPath("$.coins", is(45)))
                .andExpect(jsonPath("$.maxUnlockedLevel", is(3)))
                .andExpect(jsonPath("$.badges[0]", is("phishing_hero")));
    }

    @Test
    void getProfile_unknownLearner_isNotFound() throws Exception {
        when(learnerService.getProfile(99L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/learners/99"))
                .andExpect(status().isNotFound());
    }
}
