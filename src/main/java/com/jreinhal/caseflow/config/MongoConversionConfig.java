package com.jreinhal.caseflow.config;

import com.jreinhal.caseflow.casework.CaseCategory;
import com.jreinhal.caseflow.casework.CaseOutcome;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

/**
 * Category and outcome are stored as their lowercase keys, as the case module writes them.
 */
@Configuration
public class MongoConversionConfig {
    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(
                new CaseCategoryReadingConverter(), new CaseCategoryWritingConverter(),
                new CaseOutcomeReadingConverter(), new CaseOutcomeWritingConverter()));
    }

    @ReadingConverter
    static final class CaseCategoryReadingConverter implements Converter<String, CaseCategory> {
        private static final Logger log = LoggerFactory.getLogger(CaseCategoryReadingConverter.class);

        @Override
        public CaseCategory convert(String source) {
            if (source.isBlank()) {
                return null;
            }
            if (!CaseCategory.isKnownKey(source)) {
                log.warn("Reading unknown case category value '{}' as 'other'", source);
            }
            return CaseCategory.fromKey(source);
        }
    }

    @WritingConverter
    static final class CaseCategoryWritingConverter implements Converter<CaseCategory, String> {
        @Override
        public String convert(CaseCategory source) {
            return source.getKey();
        }
    }

    @ReadingConverter
    static final class CaseOutcomeReadingConverter implements Converter<String, CaseOutcome> {
        private static final Logger log = LoggerFactory.getLogger(CaseOutcomeReadingConverter.class);

        @Override
        public CaseOutcome convert(String source) {
            CaseOutcome outcome = CaseOutcome.fromKey(source);
            if (outcome == null && !source.isBlank()) {
                log.warn("Ignoring unknown case outcome value '{}' from persisted case", source);
            }
            return outcome;
        }
    }

    @WritingConverter
    static final class CaseOutcomeWritingConverter implements Converter<CaseOutcome, String> {
        @Override
        public String convert(CaseOutcome source) {
            return source.getKey();
        }
    }
}
