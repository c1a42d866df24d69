package com.waybackminer.app;

import com.waybackminer.app.cli.CliOptions;
import com.waybackminer.app.cli.RecordPrinter;
import com.waybackminer.app.cli.UsageException;
import com.waybackminer.app.logging.LogSetup;
import com.waybackminer.core.harvest.HarvestRun;
import com.waybackminer.core.harvest.WaybackHarvester;
import com.waybackminer.core.model.HarvestConfig;
import com.waybackminer.core.model.HarvestStats;
import com.waybackminer.core.model.UrlRecord;
import com.waybackminer.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;

/**
 * 명령행 진입점.
 * 종료 코드: 0 성공, 1 출력 실패, 2 사용법/설정 오류.
 */
public final class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_USAGE = 2;

    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private App() {}

    public static void main(String[] args) {
        LogSetup.init();
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught in {}", t.getName(), e));

        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    static int run(String[] args, PrintStream stdout, PrintStream stderr) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (UsageException e) {
            stderr.println("waybackminer: " + e.getMessage());
            stderr.print(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (opts.help()) {
            stdout.print(CliOptions.USAGE);
            return EXIT_OK;
        }

        WaybackHarvester harvester;
        try {
            HarvestConfig base = (opts.config() != null)
                    ? YamlConfigLoader.load(opts.config())
                    : YamlConfigLoader.loadDefault();
            harvester = new WaybackHarvester(opts.applyTo(base));
        } catch (IOException | IllegalArgumentException e) {
            stderr.println("waybackminer: config error: " + e.getMessage());
            return EXIT_USAGE;
        }

        HarvestRun run;
        try {
            run = harvester.run(opts.domain());
        } catch (IllegalArgumentException e) {
            stderr.println("waybackminer: " + e.getMessage());
            return EXIT_USAGE;
        }

        // Ctrl-C 시 진행 중 요청까지 정리
        Thread hook = new Thread(run::cancel, "wayback-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try (run; RecordPrinter printer = new RecordPrinter(openOutput(opts, stdout), opts.json(), opts.output() != null)) {
            for (UrlRecord r : run) {
                if (printer.print(r) && opts.hasLimit() && printer.printed() >= opts.limit()) {
                    LOG.info("Limit of {} reached, cancelling", opts.limit());
                    run.cancel();
                    break;
                }
            }
        } catch (IOException e) {
            stderr.println("waybackminer: output error: " + e.getMessage());
            return EXIT_IO;
        } finally {
            removeHook(hook);
        }
        awaitShutdown(run);

        HarvestStats.Snapshot rt = harvester.getRuntimeSnapshot();
        LOG.info("Done: domain={}, emitted={}, outOfScope={}, failures={}, requests={}",
                opts.domain(), rt.emittedTotal(), rt.outOfScope, rt.failuresTotal(), rt.requestsTotal);
        return EXIT_OK;
    }

    private static Writer openOutput(CliOptions opts, PrintStream stdout) throws IOException {
        if (opts.output() == null) return new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
        return Files.newBufferedWriter(opts.output(), StandardCharsets.UTF_8);
    }

    /** 취소된 실행은 워커 정리가 끝날 때까지 잠깐 기다린다(통계 확정용). */
    private static void awaitShutdown(HarvestRun run) {
        try {
            if (!run.awaitCompletion(SHUTDOWN_WAIT)) {
                LOG.warn("Harvest did not stop within {}", SHUTDOWN_WAIT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            // 이미 종료 중이면 훅이 곧 실행된다
        }
    }
}
