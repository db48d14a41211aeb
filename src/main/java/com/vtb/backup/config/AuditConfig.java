package com.vtb.backup.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.backup.models.WorkloadClass;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Конфигурация аудита резервного копирования из YAML файла.
 * Пороговые значения RPO, версии API и параметры HTTP вынесены сюда из кода.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuditConfig {

    public static final String DEFAULT_RESOURCE = "backup-audit-config.yaml";

    private Http http;
    private ApiVersions apiVersions;
    private Discovery discovery;
    private Thresholds thresholds;
    private Cadence cadence;
    private Posture posture;

    private static AuditConfig instance;

    /**
     * Загрузить конфигурацию из classpath (кэшируется на процесс)
     */
    public static synchronized AuditConfig load() {
        if (instance == null) {
            try (InputStream is = AuditConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (is == null) {
                    throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
                }
                instance = read(is);
            } catch (IOException e) {
                throw new RuntimeException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из произвольного файла
     */
    public static AuditConfig load(Path path) {
        if (path == null) {
            return load();
        }
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        } catch (IOException e) {
            throw new RuntimeException("Ошибка загрузки конфигурации " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация без файла: только значения по умолчанию
     */
    public static AuditConfig defaults() {
        AuditConfig config = new AuditConfig();
        config.ensureDefaults();
        return config;
    }

    static AuditConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AuditConfig config = mapper.readValue(is, AuditConfig.class);
        if (config == null) {
            config = new AuditConfig();
        }
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (http == null) {
            http = new Http();
        }
        http.ensureDefaults();
        if (apiVersions == null) {
            apiVersions = new ApiVersions();
        }
        apiVersions.ensureDefaults();
        if (discovery == null) {
            discovery = new Discovery();
        }
        discovery.ensureDefaults();
        if (thresholds == null) {
            thresholds = new Thresholds();
        }
        thresholds.ensureDefaults();
        if (cadence == null) {
            cadence = new Cadence();
        }
        cadence.ensureDefaults();
        if (posture == null) {
            posture = new Posture();
        }
        posture.ensureDefaults();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Http {
        private String baseUrl;
        private Integer maxRetries;
        private Long backoffBaseSeconds;
        private Integer timeoutSec;
        private List<Integer> retryableStatuses;
        private String continuationHeader;
        private String continuationQueryParam;
        private Integer maxPages;

        public void ensureDefaults() {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://management.azure.com";
            }
            if (maxRetries == null || maxRetries < 0) {
                maxRetries = 4;
            }
            if (backoffBaseSeconds == null || backoffBaseSeconds < 0) {
                backoffBaseSeconds = 1L;
            }
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = 30;
            }
            if (retryableStatuses == null || retryableStatuses.isEmpty()) {
                retryableStatuses = new ArrayList<>(List.of(429, 500, 502, 503, 504));
            }
            if (continuationHeader == null || continuationHeader.isBlank()) {
                continuationHeader = "x-ms-continuation";
            }
            if (continuationQueryParam == null || continuationQueryParam.isBlank()) {
                continuationQueryParam = "$skiptoken";
            }
            if (maxPages == null || maxPages <= 0) {
                maxPages = 200;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiVersions {
        private String recoveryServicesVaults;
        private String backupVaults;
        private String vaultConfigCurrent;
        private String vaultConfigLegacy;
        private String backupStorageConfig;
        private List<String> protectedItems;
        private String recoveryPoints;
        private String policies;
        private String containers;
        private String backupInstances;
        private String sqlRestorePoints;

        public void ensureDefaults() {
            if (recoveryServicesVaults == null) {
                recoveryServicesVaults = "2024-04-01";
            }
            if (backupVaults == null) {
                backupVaults = "2024-04-01";
            }
            if (vaultConfigCurrent == null) {
                vaultConfigCurrent = "2023-02-01";
            }
            if (vaultConfigLegacy == null) {
                vaultConfigLegacy = "2016-12-01";
            }
            if (backupStorageConfig == null) {
                backupStorageConfig = "2023-02-01";
            }
            if (protectedItems == null || protectedItems.isEmpty()) {
                protectedItems = new ArrayList<>(List.of("2023-02-01", "2021-12-01", "2019-05-13"));
            }
            if (recoveryPoints == null) {
                recoveryPoints = "2023-02-01";
            }
            if (policies == null) {
                policies = "2023-02-01";
            }
            if (containers == null) {
                containers = "2023-02-01";
            }
            if (backupInstances == null) {
                backupInstances = "2024-04-01";
            }
            if (sqlRestorePoints == null) {
                sqlRestorePoints = "2021-11-01";
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Discovery {
        private List<String> managementTypes;
        private List<String> protectedItemFilters;

        public void ensureDefaults() {
            if (managementTypes == null || managementTypes.isEmpty()) {
                managementTypes = new ArrayList<>(List.of("AzureIaasVM", "AzureWorkload"));
            }
            if (protectedItemFilters == null || protectedItemFilters.isEmpty()) {
                protectedItemFilters = new ArrayList<>(List.of(
                    "backupManagementType eq 'AzureIaasVM'",
                    "backupManagementType eq 'AzureWorkload'",
                    ""));
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Threshold {
        private Double warningHours;
        private Double criticalHours;

        public Threshold() {
        }

        public Threshold(double warningHours, double criticalHours) {
            this.warningHours = warningHours;
            this.criticalHours = criticalHours;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Thresholds {
        private Threshold virtualMachine;
        private Threshold vaultDatabase;
        private Threshold managedDatabase;

        public void ensureDefaults() {
            virtualMachine = withDefaults(virtualMachine, 26, 48);
            vaultDatabase = withDefaults(vaultDatabase, 4, 26);
            managedDatabase = withDefaults(managedDatabase, 2, 24);
        }

        public Threshold forClass(WorkloadClass workloadClass) {
            if (workloadClass == null) {
                return virtualMachine;
            }
            return switch (workloadClass) {
                case VIRTUAL_MACHINE -> virtualMachine;
                case VAULT_DATABASE -> vaultDatabase;
                case MANAGED_DATABASE -> managedDatabase;
            };
        }

        private static Threshold withDefaults(Threshold threshold, double warning, double critical) {
            Threshold result = threshold != null ? threshold : new Threshold();
            if (result.getWarningHours() == null || result.getWarningHours() < 0) {
                result.setWarningHours(warning);
            }
            if (result.getCriticalHours() == null || result.getCriticalHours() < 0) {
                result.setCriticalHours(critical);
            }
            return result;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Cadence {
        private Integer toleranceMinutes;
        private List<Integer> canonicalHours;

        public void ensureDefaults() {
            if (toleranceMinutes == null || toleranceMinutes < 0) {
                toleranceMinutes = 20;
            }
            if (canonicalHours == null || canonicalHours.isEmpty()) {
                canonicalHours = new ArrayList<>(List.of(1, 2, 3, 4, 6, 8, 12, 24));
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Posture {
        private Integer minimumRetentionDays;

        public void ensureDefaults() {
            if (minimumRetentionDays == null || minimumRetentionDays < 0) {
                minimumRetentionDays = 14;
            }
        }
    }
}
