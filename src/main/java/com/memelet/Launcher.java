package com.memelet;

import com.memelet.model.CatalogStats;
import com.memelet.model.MediaStatus;
import com.memelet.service.BatchResult;
import com.memelet.service.IngestResult;
import com.memelet.service.PipelineOrchestrator;
import com.memelet.util.PipelineConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 * <pre>
 * memelet [--config memelet.json] [--stats] [--scan] [--process] [--retry-errors] [--tag-scan]
 * </pre>
 * Actions run in the order stats, scan, process/retry, tag scan. Statistics are printed again
 * after any action that changes the catalog.
 */
public class Launcher {

    public static void main(String[] args) {
        Path configFile = null;
        boolean stats = false;
        boolean scan = false;
        boolean process = false;
        boolean retryErrors = false;
        boolean tagScan = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                    if (i + 1 >= args.length) {
                        System.err.println("--config requires a file argument");
                        System.exit(2);
                    }
                    configFile = Paths.get(args[++i]);
                    break;
                case "--stats":
                    stats = true;
                    break;
                case "--scan":
                    scan = true;
                    break;
                case "--process":
                    process = true;
                    break;
                case "--retry-errors":
                    retryErrors = true;
                    break;
                case "--tag-scan":
                    tagScan = true;
                    break;
                default:
                    System.err.println("Unknown argument: " + args[i]);
                    printUsage();
                    System.exit(2);
            }
        }

        if (!stats && !scan && !process && !retryErrors && !tagScan) {
            printUsage();
            return;
        }

        PipelineConfig config;
        try {
            config = PipelineConfig.load(configFile).applyEnvironment(System.getenv());
        } catch (IOException e) {
            System.err.println("Failed to load configuration: " + e.getMessage());
            System.exit(1);
            return;
        }

        try (PipelineContext context = new PipelineContext(config)) {
            PipelineOrchestrator orchestrator = context.getOrchestrator();

            if (stats) {
                printStats(orchestrator.stats());
            }
            if (scan) {
                IngestResult result = orchestrator.ingest();
                System.out.println("Scan: " + result);
            }
            if (process) {
                BatchResult result = orchestrator.processPending(false);
                System.out.println("Process: " + result);
            }
            if (retryErrors) {
                BatchResult result = orchestrator.retryErrors();
                System.out.println("Retry errors: " + result);
                // New records are analyzed too, so one retry run leaves nothing pending
                BatchResult pending = orchestrator.processPending(false);
                System.out.println("Process: " + pending);
            }
            if (tagScan) {
                int applied = orchestrator.tagScanAll();
                System.out.println("Tag scan: " + applied + " new tag associations");
            }
            if (scan || process || retryErrors || tagScan) {
                printStats(orchestrator.stats());
            }
        } catch (RuntimeException e) {
            System.err.println("Pipeline failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printStats(CatalogStats stats) {
        System.out.println("Catalog statistics:");
        System.out.println("   Total: " + stats.getTotal());
        for (MediaStatus status : MediaStatus.values()) {
            System.out.println("   - " + status.getDbValue() + ": " + stats.getCount(status));
        }
    }

    private static void printUsage() {
        System.out.println("Usage: memelet [--config <file>] [--stats] [--scan] [--process] [--retry-errors] [--tag-scan]");
        System.out.println("  --scan          verify known files, then register new ones");
        System.out.println("  --process       analyze records with status 'new'");
        System.out.println("  --retry-errors  re-verify and analyze records with status 'error', then those with status 'new'");
        System.out.println("  --tag-scan      re-apply path tags and stored model suggestions");
        System.out.println("  --stats         print record counts per status");
    }
}
