package com.deepansh.mq.cli;

import com.deepansh.mq.batch.BatchOptions;
import com.deepansh.mq.batch.BatchRunner;
import com.deepansh.mq.batch.BatchSummary;
import com.deepansh.mq.batch.StagedOutput;
import com.deepansh.mq.config.MqProperties;
import com.deepansh.mq.exception.ConfigException;
import com.deepansh.mq.exception.ErrorReporter;
import com.deepansh.mq.exception.MqException;
import com.deepansh.mq.exception.UserException;
import com.deepansh.mq.llm.LlmClient;
import com.deepansh.mq.llm.ProviderRegistry;
import com.deepansh.mq.model.ChatRequest;
import com.deepansh.mq.model.ChatResult;
import com.deepansh.mq.model.Message;
import com.deepansh.mq.model.ModelConfig;
import com.deepansh.mq.model.Session;
import com.deepansh.mq.registry.ModelRegistry;
import com.deepansh.mq.store.SessionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The {@code mq} command line. {@link #run(String...)} parses one invocation,
 * executes it and returns the process exit code:
 * 0 success, 1 batch finished with failed rows, 2 any error.
 */
@Slf4j
public class MqCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ROWS_FAILED = 1;

    static final String CONTINUE_JSON_WARNING =
            "warning: --json output does not include full conversation context (use `mq dump` for history)";

    private static final int PREVIEW_MAX = 160;
    private static final String ELLIPSIS = " ... ";

    private final ModelRegistry registry;
    private final SessionStore sessions;
    private final LlmClient llmClient;
    private final ProviderRegistry providers;
    private final BatchRunner batchRunner;
    private final MqProperties properties;
    private final ObjectMapper objectMapper;
    private final CliConsole console;
    private final ResultPrinter printer;
    private final ErrorReporter errorReporter;

    public MqCli(ModelRegistry registry,
                 SessionStore sessions,
                 LlmClient llmClient,
                 ProviderRegistry providers,
                 BatchRunner batchRunner,
                 MqProperties properties,
                 ObjectMapper objectMapper,
                 CliConsole console) {
        this.registry = registry;
        this.sessions = sessions;
        this.llmClient = llmClient;
        this.providers = providers;
        this.batchRunner = batchRunner;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.console = console;
        this.printer = new ResultPrinter(console.out(), objectMapper);
        this.errorReporter = new ErrorReporter(console.err());
    }

    public int run(String... argv) {
        if (argv.length == 0) {
            console.err().print(HelpText.SHORT);
            console.err().println("mq: error: the following arguments are required: command");
            return ErrorReporter.EXIT_ERROR;
        }
        String command = argv[0];
        List<String> rest = Arrays.asList(argv).subList(1, argv.length);
        log.debug("mq {} {}", command, rest.size());

        try {
            switch (command) {
                case "-h", "--help" -> {
                    console.out().print(HelpText.SHORT);
                    return EXIT_OK;
                }
                case "help" -> {
                    return help(rest);
                }
                case "session" -> {
                    return session(rest);
                }
                default -> { }
            }
            if (wantsHelp(rest)) {
                return help(List.of(command));
            }
            return switch (command) {
                case "add" -> add(rest);
                case "models" -> models(rest);
                case "rm" -> rm(rest);
                case "test" -> test(rest);
                case "ask" -> ask(rest);
                case "continue", "cont" -> continueSession(rest);
                case "dump" -> dump(rest);
                case "batch" -> batch(rest);
                default -> throw new UserException("Unknown command: " + command + "\n"
                        + HelpText.SHORT.lines().findFirst().orElse(""));
            };
        } catch (RuntimeException e) {
            return errorReporter.report(e);
        }
    }

    // ---- commands ----

    private int help(List<String> topics) {
        String topic = String.join(" ", topics).strip();
        if (topic.isEmpty()) {
            console.out().print(HelpText.DETAILED);
            return EXIT_OK;
        }
        String text = HelpText.topic(topic)
                .orElseThrow(() -> new UserException("No help for '" + topic + "'"));
        console.out().print(text);
        return EXIT_OK;
    }

    private int add(List<String> args) {
        CliArgs a = CliArgs.options(HelpText.ADD)
                .option("--provider")
                .option("--sysprompt")
                .option("--sysprompt-file")
                .parse(args)
                .expect("shortname", "model");
        String provider = a.required("--provider");
        providers.require(provider);
        String sysprompt = resolveSysprompt(a);

        registry.upsert(a.positional(0), ModelConfig.builder()
                .provider(provider)
                .model(a.positional(1))
                .sysprompt(sysprompt)
                .build());
        return EXIT_OK;
    }

    private int models(List<String> args) {
        CliArgs.options(HelpText.MODELS).parse(args).expect();
        Map<String, ModelConfig> models = registry.list();
        if (models.isEmpty()) {
            console.out().println("(no models configured)");
            return EXIT_OK;
        }
        models.forEach((shortname, config) ->
                console.out().println(shortname + "\t" + config.getProvider() + "\t" + config.getModel()));
        return EXIT_OK;
    }

    private int rm(List<String> args) {
        CliArgs a = CliArgs.options(HelpText.RM).parse(args).expect("shortname");
        registry.remove(a.positional(0));
        return EXIT_OK;
    }

    private int test(List<String> args) {
        CliArgs a = CliArgs.options(HelpText.TEST)
                .option("--provider")
                .option("--sysprompt")
                .option("--sysprompt-file")
                .flag("--json")
                .flag("--save")
                .parse(args)
                .expect("shortname", "model", "query");
        String provider = a.required("--provider");
        providers.require(provider);
        String sysprompt = resolveSysprompt(a);
        String query = a.positional(2);

        ModelConfig config = ModelConfig.builder()
                .provider(provider)
                .model(a.positional(1))
                .sysprompt(sysprompt)
                .build();
        ChatResult result = llmClient.chat(ChatRequest.forModel(config)
                .messages(firstTurn(sysprompt, query))
                .build());
        printer.print(result, query, sysprompt, null, a.has("--json"));

        if (a.has("--save")) {
            registry.upsert(a.positional(0), config);
        }
        return EXIT_OK;
    }

    private int ask(List<String> args) {
        CliArgs a = CliArgs.options(HelpText.ASK)
                .option("--sysprompt", "-s")
                .flag("--json")
                .flag("--no-session", "-n")
                .option("--session")
                .parse(args)
                .expect("shortname", "query");
        String shortname = a.positional(0);
        String query = a.positional(1);
        ModelConfig config = registry.get(shortname);
        String sysprompt = a.value("--sysprompt").orElse(config.getSysprompt());
        boolean save = !a.has("--no-session");

        // fail on a taken or malformed id before paying for the request
        String sessionId = save ? sessions.reserveSessionId(a.value("--session").orElse(null)) : null;

        List<Message> messages = firstTurn(sysprompt, query);
        ChatResult result = llmClient.chat(ChatRequest.forModel(config).messages(List.copyOf(messages)).build());
        printer.print(result, query, sysprompt, save ? sessionId : ResultPrinter.NO_SESSION, a.has("--json"));

        if (save) {
            messages.add(Message.assistant(result.content()));
            sessions.createSession(shortname, config.getProvider(), config.getModel(), sysprompt, messages, sessionId);
        }
        return EXIT_OK;
    }

    private int continueSession(List<String> args) {
        CliArgs a = CliArgs.options(HelpText.CONTINUE)
                .option("--session")
                .flag("--json")
                .parse(args)
                .expect("query");
        String query = a.positional(0);
        Session session = a.value("--session")
                .map(sessions::loadSession)
                .orElseGet(sessions::loadLatestSession);
        if (session.getProvider() == null || session.getModel() == null || session.getMessages() == null) {
            throw new ConfigException("Invalid last conversation format");
        }
        if (a.has("--json")) {
            console.err().println(CONTINUE_JSON_WARNING);
        }

        List<Message> messages = new ArrayList<>(session.getMessages());
        messages.add(Message.user(query));
        ChatResult result = llmClient.chat(ChatRequest.builder()
                .provider(session.getProvider())
                .model(session.getModel())
                .messages(List.copyOf(messages))
                .build());
        printer.print(result, query, session.getSysprompt(), session.getId(), a.has("--json"));

        messages.add(Message.assistant(result.content()));
        session.setMessages(messages);
        sessions.saveSession(session);
        return EXIT_OK;
    }

    private int dump(List<String> args) {
        CliArgs a = CliArgs.options(HelpText.DUMP).option("--session").parse(args).expect();
        Session session = a.value("--session")
                .map(sessions::loadSession)
                .orElseGet(sessions::loadLatestSession);
        try {
            console.out().println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(session));
        } catch (JsonProcessingException e) {
            throw new MqException("Failed to serialize session: " + e.getOriginalMessage(), e);
        }
        return EXIT_OK;
    }

    private int session(List<String> args) {
        if (args.isEmpty()) {
            throw new UserException("the following arguments are required: session_command\n"
                    + HelpText.SESSION.lines().findFirst().orElse(""));
        }
        String sub = args.get(0);
        List<String> rest = args.subList(1, args.size());
        if (sub.equals("-h") || sub.equals("--help")) {
            return help(List.of("session"));
        }
        if (wantsHelp(rest)) {
            return help(List.of("session", sub));
        }
        return switch (sub) {
            case "list" -> sessionList(rest);
            case "select" -> {
                CliArgs a = CliArgs.options(HelpText.SESSION_SELECT).parse(rest).expect("session_id");
                sessions.selectSession(a.positional(0));
                yield EXIT_OK;
            }
            case "rename" -> {
                CliArgs a = CliArgs.options(HelpText.SESSION_RENAME).parse(rest).expect("old_id", "new_id");
                sessions.renameSession(a.positional(0), a.positional(1));
                yield EXIT_OK;
            }
            default -> throw new UserException("Unknown session command: " + sub);
        };
    }

    private int sessionList(List<String> args) {
        CliArgs.options(HelpText.SESSION_LIST).parse(args).expect();
        List<Session> all = sessions.listSessions();
        if (all.isEmpty()) {
            console.out().println("(no sessions)");
            return EXIT_OK;
        }
        for (Session s : all) {
            console.out().println((s.getId() == null ? "" : s.getId()) + "\t" + s.sortKey());
            console.out().println(preview(s.firstUserPrompt()));
        }
        return EXIT_OK;
    }

    private int batch(List<String> args) {
        CliArgs a = CliArgs.options(HelpText.BATCH)
                .option("--input", "-i")
                .option("--output", "-o")
                .option("--workers", "-w")
                .option("--sysprompt", "-s")
                .option("--prefix")
                .option("--suffix")
                .flag("--extract-tags")
                .option("--timeout")
                .option("--max-retries")
                .parse(args)
                .expect("shortname");
        String shortname = a.positional(0);
        ModelConfig config = registry.get(shortname);

        BatchOptions options = BatchOptions.builder()
                .modelShortname(shortname)
                .model(config)
                .workers(a.intValue("--workers").orElse(properties.getBatch().getWorkers()))
                .sysprompt(a.value("--sysprompt").orElse(null))
                .prefix(a.value("--prefix").orElse(""))
                .suffix(a.value("--suffix").orElse(""))
                .extractTags(a.has("--extract-tags"))
                .timeout(a.intValue("--timeout").map(Duration::ofSeconds).orElse(null))
                .maxRetries(a.intValue("--max-retries").orElse(null))
                .build();

        String outputArg = a.value("--output").orElse("-");
        Supplier<StagedOutput> output = outputArg.equals("-")
                ? () -> StagedOutput.toStream(console.out())
                : () -> StagedOutput.toFile(expandHome(outputArg));

        BatchSummary summary;
        String inputArg = a.value("--input").orElse("-");
        if (inputArg.equals("-")) {
            summary = batchRunner.run(options,
                    new BufferedReader(new InputStreamReader(console.in(), StandardCharsets.UTF_8)), output);
        } else {
            Path inputPath = expandHome(inputArg);
            try (BufferedReader input = Files.newBufferedReader(inputPath, StandardCharsets.UTF_8)) {
                summary = batchRunner.run(options, input, output);
            } catch (NoSuchFileException e) {
                throw new UserException("Batch input not found: " + inputPath);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read batch input " + inputPath, e);
            }
        }

        if (!summary.allSucceeded()) {
            console.err().println(summary.errored() + " of " + summary.total() + " rows failed");
            return EXIT_ROWS_FAILED;
        }
        return EXIT_OK;
    }

    // ---- helpers ----

    private static List<Message> firstTurn(String sysprompt, String query) {
        List<Message> messages = new ArrayList<>();
        if (sysprompt != null && !sysprompt.isEmpty()) {
            messages.add(Message.system(sysprompt));
        }
        messages.add(Message.user(query));
        return messages;
    }

    private String resolveSysprompt(CliArgs a) {
        String inline = a.value("--sysprompt").orElse(null);
        String file = a.value("--sysprompt-file").orElse(null);
        boolean hasInline = inline != null && !inline.isEmpty();
        boolean hasFile = file != null && !file.isEmpty();
        if (hasInline && hasFile) {
            throw new UserException("Use only one of --sysprompt or --sysprompt-file");
        }
        if (!hasFile) {
            return inline;
        }
        String content = readSyspromptFile(file);
        int end = content.length();
        while (end > 0 && content.charAt(end - 1) == '\n') end--;
        return content.substring(0, end);
    }

    private String readSyspromptFile(String file) {
        try {
            if (file.equals("-")) {
                return new String(console.in().readAllBytes(), StandardCharsets.UTF_8);
            }
            return Files.readString(expandHome(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UserException("Failed to read sysprompt file '" + file + "': " + e.getMessage(), e);
        }
    }

    /** One line; long prompts keep their head and tail around " ... ". */
    static String preview(String prompt) {
        String line = (prompt == null ? "" : prompt).replace("\n", " ").strip();
        if (line.length() <= PREVIEW_MAX) {
            return line;
        }
        int headLen = (PREVIEW_MAX - ELLIPSIS.length()) / 2;
        int tailLen = PREVIEW_MAX - ELLIPSIS.length() - headLen;
        String head = line.substring(0, headLen).stripTrailing();
        String tail = line.substring(line.length() - tailLen).stripLeading();
        return head + ELLIPSIS + tail;
    }

    private static boolean wantsHelp(List<String> args) {
        return args.contains("-h") || args.contains("--help");
    }

    private static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }
}
