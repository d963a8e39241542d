package com.jreinhal.caseflow.casework;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class PartyNameResolverTest {
    private final PartyNameResolver resolver = new PartyNameResolver();

    @Test
    void flatNamesWin() {
        CaseRecord record = CaseFixtures.openCase(CaseCategory.LABOR, "filing");
        record.setPlaintiffName("Ahmed");
        record.setPlaintiff(new CaseRecord.PartyDetails("أحمد"));
        record.setDefendantName("Acme");

        assertEquals("Ahmed", resolver.plaintiffName(record));
        assertEquals("Acme", resolver.defendantName(record));
    }

    @Test
    void fallsBackThroughLegacyShapes() {
        CaseRecord structured = CaseFixtures.openCase(CaseCategory.CIVIL, "filing");
        structured.setPlaintiffName("  ");
        structured.setPlaintiff(new CaseRecord.PartyDetails("سارة"));

        CaseRecord labor = CaseFixtures.openCase(CaseCategory.LABOR, "filing");
        labor.setLaborCaseDetails(new CaseRecord.LaborCaseDetails(new CaseRecord.NamedParty("Worker"), new CaseRecord.NamedParty("Company LLC")));

        assertEquals("سارة", resolver.plaintiffName(structured));
        assertEquals("Worker", resolver.plaintiffName(labor));
        assertEquals("Company LLC", resolver.defendantName(labor));
    }

    @Test
    void missingNamesResolveToEmpty() {
        CaseRecord record = CaseFixtures.openCase(CaseCategory.OTHER, "filing");
        record.setLaborCaseDetails(new CaseRecord.LaborCaseDetails(null, null));

        assertEquals("", resolver.plaintiffName(record));
        assertEquals("", resolver.defendantName(record));
    }
}
