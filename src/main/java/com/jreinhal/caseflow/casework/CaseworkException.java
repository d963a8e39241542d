package com.jreinhal.caseflow.casework;

import java.util.Map;

/**
 * Failure of a pipeline or note command. Every instance is raised before the case is
 * mutated, except {@link Kind#CONFLICT} which is raised by the write itself.
 */
public class CaseworkException extends RuntimeException {
    private final Kind kind;
    private final String code;
    private final String messageAr;
    private final Map<String, Object> details;

    public CaseworkException(Kind kind, String code, String message, String messageAr) {
        this(kind, code, message, messageAr, Map.of());
    }

    public CaseworkException(Kind kind, String code, String message, String messageAr, Map<String, Object> details) {
        super(message);
        this.kind = kind;
        this.code = code;
        this.messageAr = messageAr;
        this.details = details == null ? Map.of() : details;
    }

    public Kind getKind() {
        return this.kind;
    }

    public String getCode() {
        return this.code;
    }

    public String getMessageAr() {
        return this.messageAr;
    }

    public Map<String, Object> getDetails() {
        return this.details;
    }

    public static CaseworkException invalidId() {
        return new CaseworkException(Kind.INVALID_INPUT, "INVALID_ID", "Invalid case ID", "معرف القضية غير صالح");
    }

    public static CaseworkException invalidNoteId() {
        return new CaseworkException(Kind.INVALID_INPUT, "INVALID_ID", "Invalid case or note ID", "معرف القضية أو الملاحظة غير صالح");
    }

    public static CaseworkException validation(String message, String messageAr) {
        return new CaseworkException(Kind.INVALID_INPUT, "VALIDATION_ERROR", message, messageAr);
    }

    public static CaseworkException validation(String message, String messageAr, Map<String, Object> details) {
        return new CaseworkException(Kind.INVALID_INPUT, "VALIDATION_ERROR", message, messageAr, details);
    }

    public static CaseworkException caseNotFound() {
        return new CaseworkException(Kind.NOT_FOUND, "CASE_NOT_FOUND", "Case not found", "القضية غير موجودة");
    }

    public static CaseworkException noteNotFound() {
        return new CaseworkException(Kind.NOT_FOUND, "NOTE_NOT_FOUND", "Note not found", "الملاحظة غير موجودة");
    }

    public static CaseworkException caseForbidden() {
        return new CaseworkException(Kind.FORBIDDEN, "UNAUTHORIZED", "Unauthorized - you do not have access to this case", "غير مصرح - ليس لديك صلاحية الوصول إلى هذه القضية");
    }

    public static CaseworkException notNoteCreator(String action) {
        return new CaseworkException(Kind.FORBIDDEN, "NOT_NOTE_CREATOR", "Only the note creator can " + action + " this note", "فقط منشئ الملاحظة يمكنه تعديلها أو حذفها");
    }

    public static CaseworkException caseEnded(String message) {
        return new CaseworkException(Kind.INVALID_STATE, "CASE_ALREADY_ENDED", message, "القضية منتهية بالفعل");
    }

    public static CaseworkException concurrentModification(String caseId) {
        return new CaseworkException(Kind.CONFLICT, "CONCURRENT_MODIFICATION", "Case was modified by another request, reload and retry", "تم تعديل القضية من طلب آخر، يرجى إعادة المحاولة", Map.of("caseId", caseId));
    }

    public static enum Kind {
        INVALID_INPUT,
        NOT_FOUND,
        FORBIDDEN,
        INVALID_STATE,
        INVALID_STAGE,
        CONFLICT;

    }
}
