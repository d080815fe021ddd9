package com.deepansh.mq.cli;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

final class HelpText {

    private HelpText() {}

    static final String DETAILED = """
            mq — Model Query CLI

            Common usage:
              mq add <shortname> --provider <provider> <model> [--sysprompt ... | --sysprompt-file PATH]
              mq models
              mq ask <shortname> [-s/--sysprompt ...] [--json] [-n/--no-session] [--session ID] "<query>"
              mq continue [--session <id>] [--json] "<query>"
              mq cont [--session <id>] [--json] "<query>"
              mq dump [--session <id>]
              mq session list
              mq session select <id>
              mq session rename <old-id> <new-id>
              mq batch <shortname> [-i IN.jsonl] [-o OUT.jsonl] [-w N] [-s ...] [--extract-tags]

            Notes:
              - Each `mq ask` creates a new session under ~/.mq/sessions/ unless -n/--no-session is used.
              - ~/.mq/last_conversation.json is maintained as a symlink/pointer to the latest session file.
              - If a provider returns a reasoning trace, mq prints it before the response with a `response:` header.
              - --json prints a single-line JSON object including at least `response` and `prompt`.
              - `mq test` validates a provider/model; it only saves the alias when --save is provided.
              - `mq batch` reads JSONL rows with a "prompt" field and writes one result line per row,
                in input order. Output appears only once the whole batch has finished.

            Examples:
              mq add gpt --provider openai gpt-4o-mini
              mq ask gpt "Write a haiku about recursive functions"
              mq ask -n gpt "quick question"
              mq continue "Make it funnier"
              mq test gpt --provider openai gpt-4o-mini "hello"
              mq test gpt --provider openai gpt-4o-mini --save "hello"
              mq session list
              mq continue --session <id> "follow up"
              mq batch gpt -i prompts.jsonl -o results.jsonl -w 8

            More:
              mq help <command>   # show help for a specific command
              mq --help           # short help
            """;

    static final String SHORT = """
            usage: mq [-h] {help,add,models,ask,continue,cont,dump,rm,test,session,batch} ...

            Run `mq help` for detailed help.
            """;

    static final String ADD = """
            usage: mq add [-h] --provider PROVIDER [--sysprompt SYSPROMPT] [--sysprompt-file SYSPROMPT_FILE] shortname model

            Add or update a model shortname.

              --provider PROVIDER            provider name (see mq.providers)
              --sysprompt SYSPROMPT          saved system prompt for this model
              --sysprompt-file FILE          read saved system prompt from file ('-' for stdin)
            """;

    static final String MODELS = """
            usage: mq models [-h]

            List configured models.
            """;

    static final String ASK = """
            usage: mq ask [-h] [--sysprompt SYSPROMPT] [--json] [-n] [--session SESSION] shortname query

            Ask a configured model. Starts a new session unless -n is given.

              -s, --sysprompt SYSPROMPT      override system prompt for this run
              --json                         emit a single-line JSON object
              -n, --no-session               do not create or update a session
              --session SESSION              id for the new session (default: random)
            """;

    static final String CONTINUE = """
            usage: mq continue [-h] [--session SESSION] [--json] query

            Continue the most recent conversation (alias: cont).

              --session SESSION              continue a specific session id (default: latest)
              --json                         emit a single-line JSON object
            """;

    static final String DUMP = """
            usage: mq dump [-h] [--session SESSION]

            Dump a session as JSON.

              --session SESSION              dump a specific session id (default: latest)
            """;

    static final String RM = """
            usage: mq rm [-h] shortname

            Remove a configured model shortname.
            """;

    static final String TEST = """
            usage: mq test [-h] --provider PROVIDER [--sysprompt SYSPROMPT] [--sysprompt-file SYSPROMPT_FILE] [--json] [--save] shortname model query

            Test a provider/model configuration, optionally saving it.

              --provider PROVIDER            provider name (see mq.providers)
              --sysprompt SYSPROMPT          system prompt for the test (saved with --save)
              --sysprompt-file FILE          read system prompt from file ('-' for stdin)
              --json                         emit a single-line JSON object
              --save                         save/overwrite this shortname on success
            """;

    static final String SESSION = """
            usage: mq session [-h] {list,select,rename} ...

            Manage sessions.
            """;

    static final String SESSION_LIST = """
            usage: mq session list [-h]

            List sessions, newest first.
            """;

    static final String SESSION_SELECT = """
            usage: mq session select [-h] session_id

            Make a session the latest one.
            """;

    static final String SESSION_RENAME = """
            usage: mq session rename [-h] old_id new_id

            Rename a session. The latest pointer follows the rename.
            """;

    static final String BATCH = """
            usage: mq batch [-h] [-i INPUT] [-o OUTPUT] [-w WORKERS] [-s SYSPROMPT] [--prefix PREFIX] [--suffix SUFFIX]
                            [--extract-tags] [--timeout SECONDS] [--max-retries N] shortname

            Run one request per JSONL input row and write results in input order.

              -i, --input INPUT              input JSONL file ('-' or absent for stdin)
              -o, --output OUTPUT            output JSONL file ('-' or absent for stdout)
              -w, --workers WORKERS          concurrent requests (default: mq.batch.workers)
              -s, --sysprompt SYSPROMPT      override the model's system prompt
              --prefix PREFIX                text prepended to every prompt
              --suffix SUFFIX                text appended to every prompt
              --extract-tags                 add a tag:<name> field for each <name>...</name> in the response
              --timeout SECONDS              per-request timeout
              --max-retries N                retries per request for transient failures
            """;

    private static final Map<String, String> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put("add", ADD);
        TOPICS.put("models", MODELS);
        TOPICS.put("ask", ASK);
        TOPICS.put("continue", CONTINUE);
        TOPICS.put("cont", CONTINUE);
        TOPICS.put("dump", DUMP);
        TOPICS.put("rm", RM);
        TOPICS.put("test", TEST);
        TOPICS.put("session", SESSION);
        TOPICS.put("session list", SESSION_LIST);
        TOPICS.put("session select", SESSION_SELECT);
        TOPICS.put("session rename", SESSION_RENAME);
        TOPICS.put("batch", BATCH);
        TOPICS.put("help", "usage: mq help [-h] [topic ...]\n\nShow detailed help, or help for one command.\n");
    }

    static Optional<String> topic(String topic) {
        return Optional.ofNullable(TOPICS.get(topic));
    }
}
