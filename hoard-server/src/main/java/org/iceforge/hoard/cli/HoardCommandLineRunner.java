package org.iceforge.hoard.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.api.ResponseBodies;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one command when the application is started with {@code <command> [json-request]}
 * and prints the JSON response to stdout. Exit code is 0 only on success.
 */
@Component
public class HoardCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final CommandDispatcher dispatcher;
    private final ObjectMapper mapper;
    private final PrintStream out;
    private volatile int exitCode;

    @Autowired
    public HoardCommandLineRunner(CommandDispatcher dispatcher, ObjectMapper mapper) {
        this(dispatcher, mapper, System.out);
    }

    HoardCommandLineRunner(CommandDispatcher dispatcher, ObjectMapper mapper, PrintStream out) {
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.mapper = Objects.requireNonNull(mapper);
        this.out = Objects.requireNonNull(out);
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return;
        }
        String request = positional.size() > 1 ? String.join(" ", positional.subList(1, positional.size())) : null;
        Map<String, Object> response = dispatcher.dispatch(positional.get(0), request);
        out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
        out.flush();
        exitCode = ResponseBodies.isSuccess(response) ? 0 : 1;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
