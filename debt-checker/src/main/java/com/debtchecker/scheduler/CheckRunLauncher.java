package com.debtchecker.scheduler;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.CheckRun;
import com.debtchecker.service.CheckRunService;
import com.debtchecker.service.FatalRunException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

/**
 * Runs the check once on startup, the way the command-line tool is normally used.
 *
 * Exit codes: 0 completed or partial, 1 fatal run error, 2 bad input or configuration.
 * With exit-on-completion off the application stays up and runs are started over HTTP.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CheckRunLauncher implements ApplicationRunner, ExitCodeGenerator, ApplicationListener<ContextClosedEvent> {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_INPUT = 2;

    private final CheckRunService checkRunService;
    private final DebtCheckerProperties properties;
    private final ApplicationContext context;

    private volatile int exitCode = EXIT_OK;
    private volatile boolean closing;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.info("Debt checker ready. POST /check/trigger to start a run over {}",
                    properties.getInput().getFile());
            return;
        }

        exitCode = launch();

        if (properties.isExitOnCompletion() && !closing) {
            log.info("Exiting with code {}", exitCode);
            System.exit(SpringApplication.exit(context, this));
        }
    }

    int launch() {
        try {
            CheckRun run = checkRunService.runFromInput();
            log.info("Startup run finished with status {}", run.getStatus());
            return EXIT_OK;
        } catch (FatalRunException e) {
            log.error("Run aborted: {}", e.getMessage());
            return EXIT_FATAL;
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            log.error("Cannot start run: {}", e.getMessage());
            return EXIT_INPUT;
        } catch (RuntimeException e) {
            log.error("Run failed unexpectedly: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        closing = true;
    }
}
