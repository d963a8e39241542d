package com.jreinhal.caseflow.casework;

import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Party names for cases written under older schemas. Each side is an ordered list of
 * accessors; the first non-blank value wins and a case with none resolves to "".
 */
@Component
public class PartyNameResolver {
    private static final List<Function<CaseRecord, String>> PLAINTIFF_ACCESSORS = List.of(
        CaseRecord::getPlaintiffName,
        record -> record.getPlaintiff() != null ? record.getPlaintiff().fullNameArabic() : null,
        record -> record.getLaborCaseDetails() != null && record.getLaborCaseDetails().plaintiff() != null
                ? record.getLaborCaseDetails().plaintiff().name() : null
    );

    private static final List<Function<CaseRecord, String>> DEFENDANT_ACCESSORS = List.of(
        CaseRecord::getDefendantName,
        record -> record.getDefendant() != null ? record.getDefendant().fullNameArabic() : null,
        record -> record.getLaborCaseDetails() != null && record.getLaborCaseDetails().company() != null
                ? record.getLaborCaseDetails().company().name() : null
    );

    public String plaintiffName(CaseRecord record) {
        return firstPresent(record, PLAINTIFF_ACCESSORS);
    }

    public String defendantName(CaseRecord record) {
        return firstPresent(record, DEFENDANT_ACCESSORS);
    }

    private static String firstPresent(CaseRecord record, List<Function<CaseRecord, String>> accessors) {
        for (Function<CaseRecord, String> accessor : accessors) {
            String value = accessor.apply(record);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
