package com.keyguard.cli;

import com.keyguard.service.ApiKeyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs a key command instead of serving HTTP when keyguard.cli.enabled is set,
 * then exits with the command's exit code.
 *
 * Example:
 * {@code java -jar keyguard-server.jar --spring.main.web-application-type=none
 * --keyguard.cli.enabled=true keys create --name "CI" --client-id build-bot}
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "keyguard.cli", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class ApiKeyCommandRunner implements ApplicationRunner {

    private final ApiKeyService apiKeyService;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(ApplicationArguments args) {
        List<String> commandLine = Arrays.stream(args.getSourceArgs())
                .filter(arg -> !arg.startsWith("--spring.") && !arg.startsWith("--keyguard.")
                        && !arg.startsWith("--logging."))
                .collect(Collectors.toList());

        ApiKeyCommands commands = new ApiKeyCommands(apiKeyService, System.out, System.err,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        int exitCode = commands.run(commandLine);
        log.debug("Key command finished with exit code {}", exitCode);

        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
