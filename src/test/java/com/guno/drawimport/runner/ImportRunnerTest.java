package com.guno.drawimport.runner;

import com.guno.drawimport.api.service.DrawImportService;
import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.dto.internal.ImportSummary;
import com.guno.drawimport.dto.internal.RunState;
import com.guno.drawimport.exception.StoreWriteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class ImportRunnerTest {

    private DrawImportService importService;
    private DrawSourceProperties properties;
    private ImportRunner runner;

    @BeforeEach
    void setUp() {
        importService = mock(DrawImportService.class);
        properties = new DrawSourceProperties();
        properties.getRun().setChangedExitCode(10);
        properties.getRun().setExhaustedExitCode(3);
        runner = new ImportRunner(importService, properties);
    }

    private static ImportSummary summary(String status, boolean written) {
        ImportSummary summary = ImportSummary.builder().status(status).finalState(RunState.DONE).build();
        summary.setWritten(written);
        return summary;
    }

    @Test
    void shouldSignalChangedStore() {
        when(importService.runImport()).thenReturn(summary("SUCCESS", true));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(10);
        assertThat(runner.getLastSummary().isWritten()).isTrue();
    }

    @Test
    void shouldExitCleanlyWhenNothingChanged() {
        when(importService.runImport()).thenReturn(summary("SUCCESS", false));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void shouldSignalExhaustedRun() {
        when(importService.runImport()).thenReturn(summary("NO_DATA", false));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(3);
    }

    @Test
    void shouldRethrowStoreWriteFailure() {
        StoreWriteException failure = new StoreWriteException("disk full", Path.of("data/draws.json"), null);
        when(importService.runImport()).thenThrow(failure);

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments())).isSameAs(failure);
        assertThat(runner.getLastSummary()).isNull();
    }
}
