package com.jeevo.validation.controller;

import com.jeevo.validation.domain.CaseStatus;
import com.jeevo.validation.escalation.EscalationManager;
import com.jeevo.validation.exception.InvalidCaseTransitionException;
import com.jeevo.validation.persistence.EscalatedCase;
import com.jeevo.validation.persistence.Expert;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = EscalationController.class)
class EscalationControllerWebTest {

    @Autowired
    MockMvc mvc;

    @MockitoBean
    EscalationManager escalations;

    @Test
    void resolve_passesNotes() throws Exception {
        EscalatedCase resolved = new EscalatedCase();
        resolved.setId(5L);
        resolved.transitionTo(CaseStatus.RESOLVED, Instant.parse("2025-03-01T10:00:00Z"));
        when(escalations.resolveCase(5L, "Advised ORS")).thenReturn(resolved);

        mvc.perform(post("/api/v1/cases/5/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"Advised ORS\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.status").value("resolved"));
    }

    @Test
    void close_withoutBody_isAllowed() throws Exception {
        EscalatedCase closed = new EscalatedCase();
        closed.setId(5L);
        when(escalations.closeCase(5L, null)).thenReturn(closed);

        mvc.perform(post("/api/v1/cases/5/close"))
                .andExpect(status().isOk());

        verify(escalations).closeCase(5L, null);
    }

    @Test
    void backwardTransition_returns409() throws Exception {
        when(escalations.startReview(5L))
                .thenThrow(new InvalidCaseTransitionException(5L, CaseStatus.RESOLVED, CaseStatus.IN_PROGRESS));

        mvc.perform(post("/api/v1/cases/5/start"))
                .andExpect(status().isConflict())
                .andExpect(content().string("Case 5 cannot move from resolved to in_progress"));
    }

    @Test
    void unknownCase_returns404() throws Exception {
        when(escalations.getCase(77L)).thenThrow(new IllegalArgumentException("Unknown case: 77"));

        mvc.perform(get("/api/v1/cases/77"))
                .andExpect(status().isNotFound());
    }

    @Test
    void registerExpert_returns201() throws Exception {
        Expert expert = new Expert();
        expert.setId(3L);
        expert.setName("Dr. Rao");
        expert.setPhoneNumber("+911234");
        when(escalations.registerExpert("Dr. Rao", "+911234", "general")).thenReturn(expert);

        mvc.perform(post("/api/v1/experts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Dr. Rao\", \"phoneNumber\": \"+911234\", \"specialization\": \"general\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.available").value(true));
    }

    @Test
    void registerExpert_withoutPhone_returns400() throws Exception {
        mvc.perform(post("/api/v1/experts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Dr. Rao\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(escalations);
    }

    @Test
    void availability_isUpdated() throws Exception {
        Expert expert = new Expert();
        expert.setId(3L);
        expert.setAvailable(false);
        when(escalations.setAvailability(3L, false)).thenReturn(expert);

        mvc.perform(put("/api/v1/experts/3/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"available\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(false));
    }

    @Test
    void pendingCases_forExpert() throws Exception {
        when(escalations.listPending(any())).thenReturn(List.of());

        mvc.perform(get("/api/v1/experts/3/cases/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(escalations).listPending(3L);
    }
}
