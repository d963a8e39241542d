package com.jreinhal.caseflow.casework;

import com.jreinhal.caseflow.filter.SecurityContext;
import com.jreinhal.caseflow.model.User;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/cases/{caseId}/notes"})
public class CaseNoteController {
    private final CaseNoteService noteService;

    public CaseNoteController(CaseNoteService noteService) {
        this.noteService = noteService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getNotes(@PathVariable String caseId,
                                                        @RequestParam(required=false) Integer limit,
                                                        @RequestParam(required=false) Integer offset,
                                                        @RequestParam(required=false) String sort) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status((HttpStatusCode)HttpStatus.UNAUTHORIZED).build();
        }
        NoteListing listing = noteService.listNotes(caseId, user, limit, offset, sort);
        Map<String, Object> body = success();
        body.put("notes", listing.notes());
        body.put("pagination", listing.pagination());
        return ResponseEntity.ok(body);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> addNote(@PathVariable String caseId, @RequestBody NoteRequest request) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status((HttpStatusCode)HttpStatus.UNAUTHORIZED).build();
        }
        CaseNote note = noteService.addNote(caseId, request.text(), request.isPrivate(), request.stageId(), user);
        Map<String, Object> body = success();
        body.put("note", note);
        return ResponseEntity.status((HttpStatusCode)HttpStatus.CREATED).body(body);
    }

    @PatchMapping(value={"/{noteId}"})
    public ResponseEntity<Map<String, Object>> updateNote(@PathVariable String caseId, @PathVariable String noteId, @RequestBody NoteRequest request) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status((HttpStatusCode)HttpStatus.UNAUTHORIZED).build();
        }
        CaseNote note = noteService.updateNote(caseId, noteId, request.text(), request.isPrivate(), user);
        Map<String, Object> body = success();
        body.put("note", note);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping(value={"/{noteId}"})
    public ResponseEntity<Map<String, Object>> deleteNote(@PathVariable String caseId, @PathVariable String noteId) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status((HttpStatusCode)HttpStatus.UNAUTHORIZED).build();
        }
        noteService.deleteNote(caseId, noteId, user);
        Map<String, Object> body = success();
        body.put("message", "Note deleted successfully");
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> success() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", false);
        return body;
    }

    /** Add and update share one body; {@code stageId} is ignored on update. */
    public record NoteRequest(String text, Boolean isPrivate, String stageId) {
    }
}
