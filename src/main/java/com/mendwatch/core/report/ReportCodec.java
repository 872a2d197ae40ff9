package com.mendwatch.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mendwatch.core.model.ErrorReport;

import java.util.Map;

/**
 * Converts {@link ErrorReport}s to and from their persisted form. Timestamps are written as
 * ISO-8601 strings.
 */
public class ReportCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ReportCodec() {
        this(new ObjectMapper());
    }

    public ReportCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Map<String, Object> toMap(ErrorReport report) {
        return objectMapper.convertValue(report, MAP_TYPE);
    }

    public ErrorReport fromMap(Map<String, Object> data) {
        return objectMapper.convertValue(data, ErrorReport.class);
    }

    public String toJson(ErrorReport report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(report);
    }

    public ErrorReport fromJson(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, ErrorReport.class);
    }
}
