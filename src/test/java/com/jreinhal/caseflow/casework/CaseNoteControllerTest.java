package com.jreinhal.caseflow.casework;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jreinhal.caseflow.exception.GlobalExceptionHandler;
import com.jreinhal.caseflow.filter.SecurityContext;
import com.jreinhal.caseflow.model.User;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class CaseNoteControllerTest {
    private static final String NOTES_URL = "/api/cases/" + CaseFixtures.CASE_ID + "/notes";
    private static final String NOTE_ID = "65b000000000000000000001";
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private CaseNoteService noteService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        noteService = mock(CaseNoteService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new CaseNoteController(noteService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        SecurityContext.setCurrentUser(CaseFixtures.lawyer());
    }

    @AfterEach
    void tearDown() {
        SecurityContext.clear();
    }

    @Test
    void addNoteReturns201() throws Exception {
        when(noteService.addNote(eq(CaseFixtures.CASE_ID), eq("Call the client"), eq(true), isNull(), any(User.class)))
                .thenReturn(new CaseNote(NOTE_ID, "Call the client", NOW, CaseFixtures.LAWYER_ID, NOW, null, true, "filing"));

        mockMvc.perform(post(NOTES_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Call the client\",\"isPrivate\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.error").value(false))
                .andExpect(jsonPath("$.note.id").value(NOTE_ID))
                .andExpect(jsonPath("$.note.stageId").value("filing"));
    }

    @Test
    void listNotesReturnsPagination() throws Exception {
        when(noteService.listNotes(eq(CaseFixtures.CASE_ID), any(User.class), eq(10), isNull(), eq("date")))
                .thenReturn(new NoteListing(List.of(), new NoteListing.Pagination(0, 10, 0)));

        mockMvc.perform(get(NOTES_URL).param("limit", "10").param("sort", "date"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notes").isArray())
                .andExpect(jsonPath("$.pagination.limit").value(10));
    }

    @Test
    void editByNonCreatorIs403() throws Exception {
        when(noteService.updateNote(eq(CaseFixtures.CASE_ID), eq(NOTE_ID), eq("x"), isNull(), any(User.class)))
                .thenThrow(CaseworkException.notNoteCreator("edit"));

        mockMvc.perform(patch(NOTES_URL + "/" + NOTE_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"x\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_NOTE_CREATOR"));
    }

    @Test
    void deleteMissingNoteIs404() throws Exception {
        doThrow(CaseworkException.noteNotFound()).when(noteService).deleteNote(eq(CaseFixtures.CASE_ID), eq(NOTE_ID), any(User.class));

        mockMvc.perform(delete(NOTES_URL + "/" + NOTE_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOTE_NOT_FOUND"));
    }

    @Test
    void deleteReturnsMessage() throws Exception {
        mockMvc.perform(delete(NOTES_URL + "/" + NOTE_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Note deleted successfully"));
        verify(noteService).deleteNote(eq(CaseFixtures.CASE_ID), eq(NOTE_ID), any(User.class));
    }

    @Test
    void anonymousCallerGets401() throws Exception {
        SecurityContext.clear();

        mockMvc.perform(get(NOTES_URL)).andExpect(status().isUnauthorized());
        verifyNoInteractions(noteService);
    }
}
