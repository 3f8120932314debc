package com.oslira.bulk.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.oslira.bulk.model.BatchProgress;
import com.oslira.bulk.model.BulkAnalysisRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;

import java.time.Instant;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The Boot-managed ObjectMapper configured through spring.jackson.* in application.yml.
 */
@JsonTest
class JacksonPropertiesTest {

    @Autowired
    private ObjectMapper mapper;

    @Test
    void writesDatesAsIsoStrings() throws Exception {
        String json = mapper.writeValueAsString(LocalDateTime.of(2024, 3, 1, 12, 30));

        assertThat(json).isEqualTo("\"2024-03-01T12:30:00\"");
    }

    @Test
    void writesProgressTimestampsAsIsoStrings() throws Exception {
        BatchProgress progress = new BatchProgress("batch_0123456789abcdef", "light", "running",
                10, 4, 40, false, Instant.parse("2024-03-01T12:30:00Z"), null, null, null);

        String json = mapper.writeValueAsString(progress);

        assertThat(json).contains("\"createdAt\":\"2024-03-01T12:30:00Z\"");
        assertThat(json).contains("\"overallProgress\":40");
    }

    @Test
    void ignoresUnknownRequestFields() throws Exception {
        BulkAnalysisRequest request = mapper.readValue(
                "{\"accountId\":\"a\",\"businessProfileId\":\"b\",\"analysisType\":\"light\","
                        + "\"usernames\":[\"nasa\"],\"campaign\":\"spring\"}",
                BulkAnalysisRequest.class);

        assertThat(request.usernames()).containsExactly("nasa");
        assertThat(request.analysisType()).isEqualTo("light");
    }
}
