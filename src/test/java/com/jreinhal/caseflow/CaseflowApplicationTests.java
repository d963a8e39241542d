package com.jreinhal.caseflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.jreinhal.caseflow.casework.pipeline.StageVocabulary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest(properties = {"caseflow.pipeline.stages.other[0]=intake", "caseflow.pipeline.stages.other[1]=closed_out"})
class CaseflowApplicationTests {

    @MockitoBean
    private MongoTemplate mongoTemplate;

    @Autowired
    private StageVocabulary stageVocabulary;

    @Test
    void contextLoadsWithConfiguredStageOverrides() {
        assertEquals("intake", stageVocabulary.defaultStage(null));
        assertEquals("labor_court", stageVocabulary.stagesFor("labor").get(3));
    }

    @Test
    void devAuthAgainstHostedDatabaseIsRefused() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.auth-mode", "DEV")
                .withProperty("spring.data.mongodb.uri", "mongodb+srv://cluster0.example.mongodb.net/caseflow");

        assertThrows(SecurityException.class, () -> new CaseflowApplication(environment).validateSecurityConfiguration());
    }

    @Test
    void gatewayAuthAgainstHostedDatabaseIsAllowed() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.auth-mode", "GATEWAY")
                .withProperty("spring.data.mongodb.uri", "mongodb+srv://cluster0.example.mongodb.net/caseflow");

        new CaseflowApplication(environment).validateSecurityConfiguration();
    }
}
