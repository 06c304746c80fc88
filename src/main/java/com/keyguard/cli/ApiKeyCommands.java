package com.keyguard.cli;

import com.keyguard.exception.DuplicateResourceException;
import com.keyguard.exception.InvalidRequestException;
import com.keyguard.model.dto.ApiKeyCreateRequest;
import com.keyguard.model.dto.ApiKeyCreatedResponse;
import com.keyguard.model.dto.ApiKeyListResponse;
import com.keyguard.model.dto.ApiKeyResponse;
import com.keyguard.model.entity.ApiKey;
import com.keyguard.service.ApiKeyService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Administrative key commands: create, list, revoke and info.
 *
 * <pre>
 * keys create --name NAME --client-id CLIENT [--expires-at 2030-01-01T00:00:00Z]
 * keys list [--limit 50]
 * keys revoke PREFIX_OR_ID [--force]
 * keys info PREFIX_OR_ID
 * </pre>
 */
@Slf4j
public class ApiKeyCommands {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
    private static final Map<String, String> SHORT_OPTIONS = Map.of(
            "-n", "--name",
            "-c", "--client-id",
            "-l", "--limit",
            "-f", "--force");

    private final ApiKeyService apiKeyService;
    private final PrintStream out;
    private final PrintStream err;
    private final BufferedReader in;

    public ApiKeyCommands(ApiKeyService apiKeyService, PrintStream out, PrintStream err, BufferedReader in) {
        this.apiKeyService = apiKeyService;
        this.out = out;
        this.err = err;
        this.in = in;
    }

    /**
     * Run one command.
     *
     * @param args Command line, starting with "keys"
     * @return Process exit code
     */
    public int run(List<String> args) {
        if (args.size() < 2 || !"keys".equals(args.get(0))) {
            printUsage();
            return EXIT_FAILURE;
        }
        ParsedArgs parsed = ParsedArgs.parse(args.subList(2, args.size()));
        try {
            switch (args.get(1)) {
                case "create":
                    return create(parsed);
                case "list":
                    return list(parsed);
                case "revoke":
                    return revoke(parsed);
                case "info":
                    return info(parsed);
                default:
                    printUsage();
                    return EXIT_FAILURE;
            }
        } catch (DataAccessException | TransactionException e) {
            log.debug("Database error while running key command", e);
            err.println("Error: Unable to connect to database.");
            err.println("Details: " + e.getMostSpecificCause().getMessage());
            return EXIT_FAILURE;
        }
    }

    private int create(ParsedArgs parsed) {
        String name = parsed.option("--name");
        String clientId = parsed.option("--client-id");
        if (name == null || clientId == null) {
            err.println("Error: --name and --client-id are required.");
            return EXIT_FAILURE;
        }
        Instant expiresAt;
        try {
            String expires = parsed.option("--expires-at");
            expiresAt = expires == null ? null : Instant.parse(expires);
        } catch (DateTimeParseException e) {
            err.println("Error: --expires-at must be an ISO-8601 instant, e.g. 2030-01-01T00:00:00Z");
            return EXIT_FAILURE;
        }

        ApiKeyCreatedResponse created;
        try {
            created = apiKeyService.createKey(ApiKeyCreateRequest.builder()
                    .name(name)
                    .clientId(clientId)
                    .expiresAt(expiresAt)
                    .build()).block();
        } catch (InvalidRequestException | DuplicateResourceException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        if (created == null) {
            err.println("Error: key was not created.");
            return EXIT_FAILURE;
        }

        out.println();
        out.println("API Key created successfully!");
        out.println();
        out.println("Name: " + created.getName());
        out.println("Client ID: " + created.getClientId());
        out.println("Prefix: " + created.getKeyPrefix());
        if (created.getExpiresAt() != null) {
            out.println("Expires: " + TIMESTAMP_FORMAT.format(created.getExpiresAt()));
        }
        out.println();
        out.println("IMPORTANT: Save this key now - it will only be shown once!");
        out.println();
        out.println(created.getKey());
        out.println();
        return EXIT_OK;
    }

    private int list(ParsedArgs parsed) {
        int limit;
        try {
            String value = parsed.option("--limit");
            limit = value == null ? 50 : Integer.parseInt(value);
        } catch (NumberFormatException e) {
            err.println("Error: --limit must be a number.");
            return EXIT_FAILURE;
        }
        if (limit < 1) {
            err.println("Error: --limit must be at least 1.");
            return EXIT_FAILURE;
        }

        ApiKeyListResponse page = apiKeyService.listKeys(0, limit).block();
        if (page == null || page.getKeys().isEmpty()) {
            out.println("No API keys found.");
            return EXIT_OK;
        }

        String row = "%-14s %-24s %-24s %-8s %-24s %-24s%n";
        out.printf("API Keys (%d total)%n", page.getTotal());
        out.printf(row, "Prefix", "Name", "Client ID", "Status", "Last Used", "Created");
        for (ApiKeyResponse key : page.getKeys()) {
            out.printf(row,
                    key.getKeyPrefix(),
                    key.getName(),
                    key.getClientId(),
                    key.isActive() ? "active" : "revoked",
                    key.getLastUsedAt() == null ? "Never" : TIMESTAMP_FORMAT.format(key.getLastUsedAt()),
                    TIMESTAMP_FORMAT.format(key.getCreatedAt()));
        }
        return EXIT_OK;
    }

    private int revoke(ParsedArgs parsed) {
        String target = parsed.positional(0);
        if (target == null) {
            err.println("Error: key prefix or ID is required.");
            return EXIT_FAILURE;
        }
        ApiKey key = apiKeyService.findByPrefixOrId(target).block();
        if (key == null) {
            err.println("No API key found with prefix/ID: " + target);
            return EXIT_FAILURE;
        }
        if (!key.isActive()) {
            out.printf("Key '%s' is already revoked.%n", key.getName());
            return EXIT_OK;
        }
        if (!parsed.flag("--force") && !confirm(key)) {
            out.println("Cancelled.");
            return EXIT_OK;
        }

        Boolean revoked = apiKeyService.revokeKey(key.getId()).block();
        if (Boolean.TRUE.equals(revoked)) {
            out.printf("Successfully revoked key '%s' (%s)%n", key.getName(), key.getKeyPrefix());
            return EXIT_OK;
        }
        err.println("Failed to revoke key.");
        return EXIT_FAILURE;
    }

    private int info(ParsedArgs parsed) {
        String target = parsed.positional(0);
        if (target == null) {
            err.println("Error: key prefix or ID is required.");
            return EXIT_FAILURE;
        }
        ApiKey key = apiKeyService.findByPrefixOrId(target).block();
        if (key == null) {
            err.println("No API key found with prefix/ID: " + target);
            return EXIT_FAILURE;
        }

        out.println();
        out.println("API Key Details");
        out.println("-".repeat(40));
        out.println("ID: " + key.getId());
        out.println("Name: " + key.getName());
        out.println("Client ID: " + key.getClientId());
        out.println("Prefix: " + key.getKeyPrefix());
        out.println("Status: " + (key.isActive() ? "Active" : "Revoked"));
        out.println("Created: " + TIMESTAMP_FORMAT.format(key.getCreatedAt()));
        out.println("Expires: " + (key.getExpiresAt() == null ? "Never" : TIMESTAMP_FORMAT.format(key.getExpiresAt())));
        out.println("Last Used: " + (key.getLastUsedAt() == null ? "Never" : TIMESTAMP_FORMAT.format(key.getLastUsedAt())));
        if (key.getRevokedAt() != null) {
            out.println("Revoked At: " + TIMESTAMP_FORMAT.format(key.getRevokedAt()));
        }
        out.println();
        return EXIT_OK;
    }

    private boolean confirm(ApiKey key) {
        out.printf("Key to revoke: %s (%s)%n", key.getName(), key.getKeyPrefix());
        out.print("Are you sure you want to revoke this key? [y/N]: ");
        out.flush();
        try {
            String answer = in.readLine();
            return answer != null && ("y".equalsIgnoreCase(answer.trim()) || "yes".equalsIgnoreCase(answer.trim()));
        } catch (IOException e) {
            log.warn("Could not read confirmation", e);
            return false;
        }
    }

    private void printUsage() {
        err.println("Usage:");
        err.println("  keys create --name NAME --client-id CLIENT [--expires-at ISO_INSTANT]");
        err.println("  keys list [--limit N]");
        err.println("  keys revoke PREFIX_OR_ID [--force]");
        err.println("  keys info PREFIX_OR_ID");
    }

    /**
     * Options ("--name x", "--name=x", "-n x"), flags ("--force") and positionals.
     */
    static final class ParsedArgs {

        private static final List<String> FLAGS = List.of("--force");

        private final Map<String, String> options = new HashMap<>();
        private final List<String> positionals = new ArrayList<>();

        static ParsedArgs parse(List<String> args) {
            ParsedArgs parsed = new ParsedArgs();
            for (int i = 0; i < args.size(); i++) {
                String arg = SHORT_OPTIONS.getOrDefault(args.get(i), args.get(i));
                if (!arg.startsWith("-")) {
                    parsed.positionals.add(arg);
                } else if (arg.contains("=")) {
                    int eq = arg.indexOf('=');
                    parsed.options.put(arg.substring(0, eq), arg.substring(eq + 1));
                } else if (FLAGS.contains(arg)) {
                    parsed.options.put(arg, "true");
                } else if (i + 1 < args.size()) {
                    parsed.options.put(arg, args.get(++i));
                }
            }
            return parsed;
        }

        String option(String name) {
            return options.get(name);
        }

        boolean flag(String name) {
            return "true".equals(options.get(name));
        }

        String positional(int index) {
            return index < positionals.size() ? positionals.get(index) : null;
        }
    }
}
