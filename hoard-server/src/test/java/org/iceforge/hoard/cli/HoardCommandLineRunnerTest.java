package org.iceforge.hoard.cli;

import org.iceforge.hoard.api.ResponseBodies;
import org.iceforge.hoard.result.ErrorKind;
import org.iceforge.hoard.store.HoardObjectMappers;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class HoardCommandLineRunnerTest {

    private final CommandDispatcher dispatcher = mock(CommandDispatcher.class);
    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private final HoardCommandLineRunner runner = new HoardCommandLineRunner(dispatcher,
            HoardObjectMappers.metadataMapper(), new PrintStream(buf, true, StandardCharsets.UTF_8));

    @Test
    void noCommand_doesNothing() throws Exception {
        runner.run(new DefaultApplicationArguments("--server.port=9090"));

        verifyNoInteractions(dispatcher);
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void success_printsJsonAndExitsZero() throws Exception {
        when(dispatcher.dispatch(eq("stats"), isNull())).thenReturn(Map.of("success", true, "total_entries", 0));

        runner.run(new DefaultApplicationArguments("stats"));

        String out = buf.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("\"success\" : true"), out);
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void failure_exitsNonZero() throws Exception {
        String req = "{\"model_id\":\"m\"}";
        when(dispatcher.dispatch("list_versions", req))
                .thenReturn(ResponseBodies.failure(ErrorKind.NOT_FOUND, "Model m not found"));

        runner.run(new DefaultApplicationArguments("list_versions", req));

        assertTrue(buf.toString(StandardCharsets.UTF_8).contains("not_found"));
        assertEquals(1, runner.getExitCode());
    }
}
