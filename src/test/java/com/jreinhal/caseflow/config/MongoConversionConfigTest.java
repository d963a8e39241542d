package com.jreinhal.caseflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.jreinhal.caseflow.casework.CaseCategory;
import com.jreinhal.caseflow.casework.CaseOutcome;
import org.junit.jupiter.api.Test;

class MongoConversionConfigTest {

    @Test
    void categoryReadsCaseInsensitivelyWithFallback() {
        MongoConversionConfig.CaseCategoryReadingConverter reader = new MongoConversionConfig.CaseCategoryReadingConverter();

        assertEquals(CaseCategory.LABOR, reader.convert("Labor"));
        assertEquals(CaseCategory.OTHER, reader.convert("maritime"));
        assertNull(reader.convert(""));
    }

    @Test
    void outcomeReadsUnknownAsNull() {
        MongoConversionConfig.CaseOutcomeReadingConverter reader = new MongoConversionConfig.CaseOutcomeReadingConverter();

        assertEquals(CaseOutcome.WON, reader.convert("won"));
        assertNull(reader.convert("dismissed"));
    }

    @Test
    void writesLowercaseKeys() {
        assertEquals("administrative", new MongoConversionConfig.CaseCategoryWritingConverter().convert(CaseCategory.ADMINISTRATIVE));
        assertEquals("settled", new MongoConversionConfig.CaseOutcomeWritingConverter().convert(CaseOutcome.SETTLED));
    }
}
