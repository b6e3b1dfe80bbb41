package com.debtchecker.scheduler;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.CheckRun;
import com.debtchecker.service.CheckRunService;
import com.debtchecker.service.FatalReason;
import com.debtchecker.service.FatalRunException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ApplicationContext;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CheckRunLauncherTest {

    private CheckRunService service;
    private DebtCheckerProperties properties;
    private CheckRunLauncher launcher;

    @BeforeEach
    void setUp() {
        service = mock(CheckRunService.class);
        properties = new DebtCheckerProperties();
        properties.setExitOnCompletion(false);
        launcher = new CheckRunLauncher(service, properties, mock(ApplicationContext.class));
    }

    @Test
    void completedAndPartialRunsExitWithZero() {
        when(service.runFromInput()).thenReturn(
                CheckRun.builder().status(CheckRun.RunStatus.PARTIAL).build());

        launcher.run(new DefaultApplicationArguments());

        assertThat(launcher.getExitCode()).isEqualTo(CheckRunLauncher.EXIT_OK);
    }

    @Test
    void fatalRunExitsWithOne() {
        when(service.runFromInput()).thenThrow(new FatalRunException(FatalReason.AUTH_REJECTED, "602"));

        launcher.run(new DefaultApplicationArguments());

        assertThat(launcher.getExitCode()).isEqualTo(CheckRunLauncher.EXIT_FATAL);
    }

    @Test
    void missingInputExitsWithTwo() {
        when(service.runFromInput()).thenThrow(new IllegalArgumentException("Input file not found"));

        assertThat(launcher.launch()).isEqualTo(CheckRunLauncher.EXIT_INPUT);
    }

    @Test
    void unreadableInputExitsWithTwo() {
        when(service.runFromInput()).thenThrow(new UncheckedIOException(new IOException("denied")));

        assertThat(launcher.launch()).isEqualTo(CheckRunLauncher.EXIT_INPUT);
    }

    @Test
    void doesNothingWhenStartupRunDisabled() {
        properties.setRunOnStartup(false);

        launcher.run(new DefaultApplicationArguments());

        verify(service, never()).runFromInput();
        assertThat(launcher.getExitCode()).isZero();
    }
}
