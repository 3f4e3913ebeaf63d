package com.storesync.cli;

import com.storesync.common.CancellationToken;
import com.storesync.config.ReportProperties;
import com.storesync.deploy.DeploymentPipeline;
import com.storesync.deploy.DeploymentReport;
import com.storesync.deploy.ReportStorage;
import com.storesync.deploy.StageReport;
import com.storesync.desired.DesiredConfigLoader;
import com.storesync.diff.DiffEngine;
import com.storesync.diff.DiffSummary;
import com.storesync.diff.DiffSummaryFormatter;
import com.storesync.domain.EntityType;
import com.storesync.domain.StoreConfig;
import com.storesync.reconcile.RemoteStateReader;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@code diff --config=store.yml [--include=channels,warehouses] [--exclude=products]} prints the plan;
 * {@code deploy ...} applies creates and updates and saves a report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreSyncCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String DEFAULT_CONFIG = "config.yml";

    private final DesiredConfigLoader configLoader;
    private final RemoteStateReader stateReader;
    private final DiffEngine diffEngine;
    private final DeploymentPipeline pipeline;
    private final ReportStorage reportStorage;
    private final ReportProperties reportProperties;

    private final CancellationToken token = new CancellationToken();
    private volatile ExitCode exitCode = ExitCode.SUCCESS;

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            printUsage();
            return;
        }
        try {
            Path configPath = Path.of(optionValue(args, "config", DEFAULT_CONFIG));
            Set<EntityType> include = entityTypes(args);
            switch (commands.get(0)) {
                case "diff" -> diff(configPath, include);
                case "deploy" -> deploy(configPath, include);
                default -> {
                    System.err.println("Unknown command: " + commands.get(0));
                    printUsage();
                    exitCode = ExitCode.VALIDATION;
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            exitCode = ExitCode.VALIDATION;
        } catch (RuntimeException e) {
            exitCode = ExitCode.forException(e);
            log.error("Command failed ({}): {}", exitCode, e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
        }
    }

    private void diff(Path configPath, Set<EntityType> include) {
        StoreConfig desired = configLoader.load(configPath);
        StoreConfig current = stateReader.read(include, token);
        DiffSummary summary = diffEngine.diff(desired, current, include);
        System.out.print(DiffSummaryFormatter.format(summary));
    }

    private void deploy(Path configPath, Set<EntityType> include) {
        StoreConfig desired = configLoader.load(configPath);
        DeploymentReport report = pipeline.deploy(desired, include, token);
        printReport(report);
        if (reportProperties.isEnabled()) {
            reportStorage.save(report);
        }
        if (report.hasFailures() || report.cancelled()) {
            exitCode = ExitCode.PARTIAL_FAILURE;
        }
    }

    private static void printReport(DeploymentReport report) {
        System.out.printf("Planned: %d create, %d update, %d delete (deletions are not applied)%n",
                report.creates(), report.updates(), report.deletes());
        for (StageReport stage : report.stages()) {
            System.out.printf("%s: %d created, %d updated, %d unchanged, %d failed (%d ms)%n",
                    stage.stageName(), stage.created(), stage.updated(), stage.unchanged(),
                    stage.failures().size(), stage.durationMs());
            for (StageReport.FailedEntity f : stage.failures()) {
                System.out.printf("    %s: %s%n", f.key(), f.message());
            }
            if (stage.error() != null) {
                System.out.printf("    stage error: %s%n", stage.error());
            }
        }
        System.out.printf("Resilience: %d rate limit(s), %d retr(ies), %d GraphQL error(s), %d network error(s)%n",
                report.totals().rateLimitHits(), report.totals().retryAttempts(),
                report.totals().graphqlErrors(), report.totals().networkErrors());
        System.out.printf("Finished in %d ms%s%n", report.durationMs(), report.cancelled() ? " (cancelled)" : "");
    }

    static Set<EntityType> entityTypes(ApplicationArguments args) {
        Set<EntityType> types = EnumSet.allOf(EntityType.class);
        String include = optionValue(args, "include", null);
        if (include != null && !include.isBlank()) {
            types = EnumSet.noneOf(EntityType.class);
            for (String name : include.split(",")) {
                types.add(EntityType.fromName(name));
            }
        }
        String exclude = optionValue(args, "exclude", null);
        if (exclude != null && !exclude.isBlank()) {
            for (String name : exclude.split(",")) {
                types.remove(EntityType.fromName(name));
            }
        }
        return types;
    }

    private static String optionValue(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? defaultValue : values.get(0);
    }

    private static void printUsage() {
        System.out.println("Usage: store-sync <diff|deploy> [--config=config.yml] [--include=a,b] [--exclude=c]");
    }

    @PreDestroy
    void cancelRunningWork() {
        token.cancel("Shutting down");
    }

    @Override
    public int getExitCode() {
        return exitCode.code();
    }
}
