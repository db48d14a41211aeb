package com.vtb.backup.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.backup.models.AuditResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Генератор отчетов в формате JSON.
 * Строки отчета потребляет внешний экспорт в таблицы.
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void generate(AuditResult result, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        if (result == null) {
            throw new IllegalArgumentException("AuditResult не может быть null");
        }

        String json = toJson(result);
        Files.writeString(outputPath, json);

        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    public String toJson(AuditResult result) throws IOException {
        return objectMapper.writeValueAsString(sanitize(result));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    private AuditResult sanitize(AuditResult result) {
        if (result.getFindings() == null) {
            result.setFindings(new ArrayList<>());
        }
        result.getFindings().removeIf(Objects::isNull);
        if (result.getProtectedItems() == null) {
            result.setProtectedItems(new ArrayList<>());
        }
        if (result.getVaultPostures() == null) {
            result.setVaultPostures(new ArrayList<>());
        }
        if (result.getCoverage() == null) {
            result.setCoverage(new ArrayList<>());
        }
        return result;
    }
}
