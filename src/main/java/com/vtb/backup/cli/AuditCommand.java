package com.vtb.backup.cli;

import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.core.BackupAuditor;
import com.vtb.backup.http.AuthenticationException;
import com.vtb.backup.http.ResilientGetClient;
import com.vtb.backup.http.StaticTokenProvider;
import com.vtb.backup.http.TelemetryCollector;
import com.vtb.backup.models.AuditResult;
import com.vtb.backup.models.Finding;
import com.vtb.backup.models.InventoryResource;
import com.vtb.backup.models.Severity;
import com.vtb.backup.reports.JsonReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI команда аудита резервного копирования
 */
@Slf4j
@Command(
    name = "backup-audit",
    mixinStandardHelpOptions = true,
    version = "VTB Backup Posture Scanner 1.0.0",
    description = """

        VTB Backup Posture Scanner

        Аудит резервного копирования: состояние хранилищ, периодичность и наблюдаемый RPO

        """
)
public class AuditCommand implements Callable<Integer> {

    static final String TOKEN_ENV = "ARM_ACCESS_TOKEN";

    @Parameters(
        description = "Идентификаторы подписок",
        arity = "0..*"
    )
    private List<String> subscriptions = new ArrayList<>();

    @Option(
        names = {"--inventory"},
        description = "JSON файл инвентаря (массив ВМ и управляемых БД)"
    )
    private Path inventoryPath;

    @Option(
        names = {"--config"},
        description = "YAML файл конфигурации (по умолчанию из classpath)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию: ./reports)"
    )
    private String outputDir = "./reports";

    @Option(
        names = {"--fail-on-high"},
        description = "Код выхода 2 при наличии находок HIGH (для CI/CD)"
    )
    private boolean failOnHigh = false;

    private final String environmentToken;

    public AuditCommand() {
        this(System.getenv(TOKEN_ENV));
    }

    AuditCommand(String environmentToken) {
        this.environmentToken = environmentToken;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AuditCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (environmentToken == null || environmentToken.isBlank()) {
            log.error("Не задан токен доступа: переменная окружения {}", TOKEN_ENV);
            return 1;
        }
        try {
            AuditConfig config = AuditConfig.load(configPath);
            List<InventoryResource> inventory = new InventoryLoader().load(inventoryPath);

            ResilientGetClient client = new ResilientGetClient(config.getHttp(),
                new StaticTokenProvider(environmentToken), new TelemetryCollector());
            AuditResult result = new BackupAuditor(config, client, Clock.systemUTC()).audit(subscriptions, inventory);

            Path outputPath = Paths.get(outputDir);
            outputPath.toFile().mkdirs();
            JsonReportGenerator generator = new JsonReportGenerator();
            generator.generate(result, outputPath.resolve("backup-audit." + generator.getFileExtension()));

            printSummary(result);

            if (failOnHigh && result.hasHighFindings()) {
                log.error("Обнаружены находки HIGH (--fail-on-high)");
                return 2;
            }
            log.info("Аудит завершен успешно");
            return 0;
        } catch (AuthenticationException e) {
            log.error("Ошибка аутентификации, аудит прерван: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Ошибка при аудите: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void printSummary(AuditResult result) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("VTB BACKUP POSTURE AUDIT");
        System.out.println("=".repeat(80));
        System.out.println("Подписок: " + result.getStatistics().getSubscriptions());
        System.out.println("Хранилищ: " + result.getStatistics().getVaults());
        System.out.println("Защищенных ресурсов: " + result.getStatistics().getProtectedItems());
        System.out.println("Без покрытия: " + result.getStatistics().getUncoveredResources());
        System.out.println();
        for (Severity severity : Severity.values()) {
            System.out.printf("%-7s %d%n", severity.name() + ":", result.getFindingCountBySeverity(severity));
        }
        List<Finding> top = result.getFindings().stream().limit(10).toList();
        if (!top.isEmpty()) {
            System.out.println();
            System.out.println("ТОП НАХОДКИ:");
            top.forEach(f -> System.out.printf("   [%s] %s: %s%n", f.getSeverity(), f.getSubjectName(), f.getDetail()));
        }
        if (result.getTelemetry() != null && result.getTelemetry().getNotices() != null) {
            result.getTelemetry().getNotices().forEach(notice -> System.out.println("   ! " + notice));
        }
        System.out.println();
        System.out.println("Отчет сохранен в: " + outputDir);
        System.out.println("=".repeat(80));
    }
}
