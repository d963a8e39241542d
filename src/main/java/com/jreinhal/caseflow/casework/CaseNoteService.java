package com.jreinhal.caseflow.casework;

import com.jreinhal.caseflow.casework.pipeline.PipelineProperties;
import com.jreinhal.caseflow.casework.pipeline.StageVocabulary;
import com.jreinhal.caseflow.model.User;
import com.jreinhal.caseflow.util.LogSanitizer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CaseNoteService {
    private static final Logger log = LoggerFactory.getLogger(CaseNoteService.class);
    static final int MAX_NOTE_LENGTH = 5000;
    static final int DEFAULT_LIMIT = 50;
    static final String DEFAULT_SORT = "-date";
    private static final Set<String> SORT_FIELDS = Set.of("date", "createdAt", "updatedAt");

    private final CaseAccessPolicy accessPolicy;
    private final CaseStore caseStore;
    private final StageVocabulary vocabulary;
    private final PipelineProperties properties;
    private final Clock clock;

    public CaseNoteService(CaseAccessPolicy accessPolicy, CaseStore caseStore, StageVocabulary vocabulary, PipelineProperties properties, Clock clock) {
        this.accessPolicy = accessPolicy;
        this.caseStore = caseStore;
        this.vocabulary = vocabulary;
        this.properties = properties;
        this.clock = clock;
    }

    public NoteListing listNotes(String caseId, User user, Integer limit, Integer offset, String sort) {
        int pageSize = limit == null ? DEFAULT_LIMIT : limit;
        int skip = offset == null ? 0 : offset;
        if (pageSize < 1 || pageSize > properties.getMaxNotePageSize()) {
            throw CaseworkException.validation("Limit must be between 1 and " + properties.getMaxNotePageSize(), "حد الصفحة غير صالح");
        }
        if (skip < 0) {
            throw CaseworkException.validation("Offset must not be negative", "الإزاحة غير صالحة");
        }
        Comparator<CaseNote> order = comparatorFor(sort == null || sort.isBlank() ? DEFAULT_SORT : sort.trim());
        CaseRecord record = accessPolicy.requireAccessibleCase(caseId, user);

        List<CaseNote> visible = new ArrayList<>();
        for (CaseNote note : notesOf(record)) {
            if (note.isVisibleTo(user.getId())) {
                visible.add(note);
            }
        }
        visible.sort(order);
        int total = visible.size();
        int from = Math.min(skip, total);
        int to = Math.min(from + pageSize, total);
        return new NoteListing(List.copyOf(visible.subList(from, to)), new NoteListing.Pagination(total, pageSize, skip));
    }

    public CaseNote addNote(String caseId, String text, Boolean isPrivate, String stageId, User user) {
        CaseRecord record = accessPolicy.requireAccessibleCase(caseId, user);
        String noteText = requireText(text);
        String stage;
        if (stageId != null && !stageId.isBlank()) {
            CaseCategory category = record.resolvedCategory();
            if (!vocabulary.isValidStage(category, stageId)) {
                throw new InvalidStageException(category.getKey(), stageId, vocabulary.stagesFor(category));
            }
            stage = stageId;
        } else {
            stage = vocabulary.effectiveStage(record);
        }
        Instant now = clock.instant();
        CaseNote note = new CaseNote(new ObjectId().toHexString(), noteText, now, user.getId(), now, null, Boolean.TRUE.equals(isPrivate), stage);
        List<CaseNote> notes = new ArrayList<>(notesOf(record));
        notes.add(0, note);
        record.setNotes(notes);
        record.setUpdatedAt(now);
        caseStore.save(record, record.currentRevision(), CaseStore.Change.NOTES);
        log.info("Note {} added to case {} by {} {}", note.id(), caseId, user.getId(), LogSanitizer.textSummary(noteText));
        return note;
    }

    public CaseNote updateNote(String caseId, String noteId, String text, Boolean isPrivate, User user) {
        if (!CaseAccessPolicy.isValidId(caseId) || !CaseAccessPolicy.isValidId(noteId)) {
            throw CaseworkException.invalidNoteId();
        }
        CaseRecord record = accessPolicy.requireAccessibleCase(caseId, user);
        List<CaseNote> notes = new ArrayList<>(notesOf(record));
        int index = indexOf(notes, noteId);
        CaseNote note = notes.get(index);
        if (!note.isCreatedBy(user.getId())) {
            throw CaseworkException.notNoteCreator("edit");
        }
        String newText = text != null ? requireText(text) : null;
        Instant now = clock.instant();
        CaseNote updated = note;
        if (newText != null) {
            updated = updated.withText(newText, now);
        }
        if (isPrivate != null) {
            updated = updated.withPrivacy(isPrivate, now);
        }
        notes.set(index, updated);
        record.setNotes(notes);
        record.setUpdatedAt(now);
        caseStore.save(record, record.currentRevision(), CaseStore.Change.NOTES);
        log.info("Note {} on case {} updated by {}", noteId, caseId, user.getId());
        return updated;
    }

    public void deleteNote(String caseId, String noteId, User user) {
        if (!CaseAccessPolicy.isValidId(caseId) || !CaseAccessPolicy.isValidId(noteId)) {
            throw CaseworkException.invalidNoteId();
        }
        CaseRecord record = accessPolicy.requireAccessibleCase(caseId, user);
        List<CaseNote> notes = new ArrayList<>(notesOf(record));
        int index = indexOf(notes, noteId);
        if (!notes.get(index).isCreatedBy(user.getId())) {
            throw CaseworkException.notNoteCreator("delete");
        }
        notes.remove(index);
        record.setNotes(notes);
        record.setUpdatedAt(clock.instant());
        caseStore.save(record, record.currentRevision(), CaseStore.Change.NOTES);
        log.info("Note {} on case {} deleted by {}", noteId, caseId, user.getId());
    }

    private static List<CaseNote> notesOf(CaseRecord record) {
        return record.getNotes() != null ? record.getNotes() : List.of();
    }

    private static int indexOf(List<CaseNote> notes, String noteId) {
        for (int i = 0; i < notes.size(); i++) {
            if (noteId.equals(notes.get(i).id())) {
                return i;
            }
        }
        throw CaseworkException.noteNotFound();
    }

    private static String requireText(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw CaseworkException.validation("Note text is required", "نص الملاحظة مطلوب");
        }
        String trimmed = text.trim();
        if (trimmed.length() > MAX_NOTE_LENGTH) {
            throw CaseworkException.validation("Note text must not exceed " + MAX_NOTE_LENGTH + " characters", "نص الملاحظة طويل جداً",
                    Map.of("maxLength", MAX_NOTE_LENGTH));
        }
        return trimmed;
    }

    /**
     * {@code field} ascending or {@code -field} descending. A note missing the field is
     * ordered by its creation time, then its date.
     */
    static Comparator<CaseNote> comparatorFor(String sort) {
        boolean descending = sort.startsWith("-");
        String field = descending ? sort.substring(1) : sort;
        if (!SORT_FIELDS.contains(field)) {
            throw CaseworkException.validation("Sort must be one of date, createdAt, updatedAt", "ترتيب غير صالح",
                    Map.of("validSortFields", SORT_FIELDS.stream().sorted().toList()));
        }
        Function<CaseNote, Instant> primary = switch (field) {
            case "createdAt" -> CaseNote::createdAt;
            case "updatedAt" -> CaseNote::updatedAt;
            default -> CaseNote::date;
        };
        Function<CaseNote, Instant> key = note -> {
            Instant value = primary.apply(note);
            if (value == null) {
                value = note.createdAt();
            }
            return value != null ? value : note.date();
        };
        Comparator<CaseNote> ascending = Comparator.comparing(key, Comparator.nullsFirst(Comparator.naturalOrder()));
        return descending ? ascending.reversed() : ascending;
    }
}
