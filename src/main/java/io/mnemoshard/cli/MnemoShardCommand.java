package io.mnemoshard.cli;

import io.mnemoshard.config.MnemoShardConfig;
import io.mnemoshard.config.ShardSettings;
import io.mnemoshard.generation.GenerationEngine;
import io.mnemoshard.generation.GenerationException;
import io.mnemoshard.generation.GenerationRequest;
import io.mnemoshard.generation.GenerationResult;
import io.mnemoshard.generation.ShardExporter;
import io.mnemoshard.model.RecoveryVerdict;
import io.mnemoshard.model.ShareEntry;
import io.mnemoshard.observability.AuditLogger;
import io.mnemoshard.recovery.DecryptionListener;
import io.mnemoshard.recovery.IntakeRejection;
import io.mnemoshard.recovery.PasswordPrompt;
import io.mnemoshard.recovery.RecoveredSecret;
import io.mnemoshard.recovery.RecoveryEngine;
import io.mnemoshard.recovery.RecoveryError;
import io.mnemoshard.recovery.RecoveryException;
import io.mnemoshard.recovery.RecoverySession;
import io.mnemoshard.security.OpenPgpPasswordCipher;
import io.mnemoshard.security.PasswordPolicy;
import io.mnemoshard.sharing.ShamirSecretSharing;
import io.mnemoshard.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "mnemoshard",
        mixinStandardHelpOptions = true,
        description = "Split a mnemonic into threshold shards and recover it from them",
        subcommands = {
                MnemoShardCommand.GenerateCommand.class,
                MnemoShardCommand.RecoverCommand.class,
                MnemoShardCommand.InspectCommand.class,
                MnemoShardCommand.PasswordCommand.class,
                MnemoShardCommand.AuditVerifyCommand.class
        }
)
public final class MnemoShardCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_RECOVERY_FAILED = 2;
    static final int EXIT_CANCELLED = 3;

    @Option(names = {"--home"}, description = "Working directory for settings and audit log", defaultValue = MnemoShardConfig.DEFAULT_HOME)
    String home;

    @Override
    public void run() {
        System.out.println("Use subcommands: generate | recover | inspect | password | audit-verify");
    }

    MnemoShardConfig config() {
        return MnemoShardConfig.fromRoot(home);
    }

    ShardSettings settings() {
        return ShardSettings.load(config());
    }

    AuditLogger auditLogger(ShardSettings settings) {
        return new AuditLogger(config().auditFile(), settings.auditSigningSecret());
    }

    RecoveryEngine recoveryEngine() {
        ShardSettings settings = settings();
        return new RecoveryEngine(new ShamirSecretSharing(), new OpenPgpPasswordCipher(), settings, auditLogger(settings));
    }

    static BufferedReader stdin() {
        return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    static Map<String, Object> verdictView(RecoveryVerdict verdict) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", verdict.status().name());
        out.put("have", verdict.have());
        out.put("need", verdict.need());
        out.put("pending", verdict.pending());
        if (!verdict.duplicateIndices().isEmpty()) {
            out.put("duplicateIndices", verdict.duplicateIndices());
        }
        out.put("message", verdict.message());
        return out;
    }

    static Map<String, Object> entryView(ShareEntry entry) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("source", entry.source());
        out.put("format", entry.input().format().name());
        out.put("status", entry.status().name());
        entry.usableRecord().ifPresent(record -> {
            out.put("index", record.ordinalIndex());
            out.put("threshold", record.threshold());
            out.put("total", record.totalCount());
        });
        if (entry.error() != null) {
            out.put("error", entry.error());
        }
        return out;
    }

    static List<Map<String, Object>> rejectionViews(List<IntakeRejection> rejections) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (IntakeRejection rejection : rejections) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("source", rejection.source());
            view.put("reason", rejection.reason().name());
            view.put("message", rejection.message());
            out.add(view);
        }
        return out;
    }

    /**
     * Batch options shared by {@code recover} and {@code inspect}.
     */
    abstract static class BatchOptions {
        @Parameters(arity = "0..*", paramLabel = "FILE", description = "Shard files (.txt, .gpg, .asc)")
        List<Path> files = new ArrayList<>();

        @Option(names = {"--paste-file"}, description = "Text file whose lines are treated as pasted shards")
        List<Path> pasteFiles = new ArrayList<>();

        @Option(names = {"--stdin"}, description = "Read pasted shards from standard input")
        boolean fromStdin;

        RecoverySession fill(RecoverySession session) {
            for (Path pasteFile : pasteFiles) {
                try {
                    session.addPastedText(Files.readString(pasteFile, StandardCharsets.UTF_8));
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read paste file: " + pasteFile, e);
                }
            }
            if (fromStdin) {
                StringBuilder pasted = new StringBuilder();
                try {
                    BufferedReader reader = stdin();
                    String line;
                    while ((line = reader.readLine()) != null) {
                        pasted.append(line).append('\n');
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read standard input", e);
                }
                session.addPastedText(pasted.toString());
            }
            for (Path file : files) {
                session.addFile(file).ifPresent(rejection -> System.err.println("WARN " + rejection.message()));
            }
            return session;
        }
    }

    @Command(name = "generate", description = "Split a secret phrase into shards and write share files")
    static final class GenerateCommand implements Callable<Integer> {
        @ParentCommand
        MnemoShardCommand parent;

        @Option(names = {"--secret-file"}, description = "File holding the secret phrase; standard input when omitted")
        Path secretFile;

        @Option(names = {"-n", "--total"}, defaultValue = "" + MnemoShardConfig.DEFAULT_TOTAL_SHARES, description = "Number of shards")
        int total;

        @Option(names = {"-t", "--threshold"}, defaultValue = "0", description = "Shards needed to recover; 0 uses the configured default")
        int threshold;

        @Option(names = {"--password"}, arity = "0..1", interactive = true, description = "Also write password-encrypted shard files")
        String password;

        @Option(names = {"--binary"}, description = "Write encrypted shards as binary OpenPGP packets instead of armored text")
        boolean binary;

        @Option(names = {"--out"}, description = "Output directory; defaults to <home>/shares")
        Path out;

        @Option(names = {"--print"}, description = "Also print the plaintext tokens")
        boolean print;

        @Override
        public Integer call() {
            ShardSettings settings = parent.settings();
            String secret;
            try {
                secret = secretFile == null
                        ? readAll(stdin())
                        : Files.readString(secretFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                System.err.println("ERROR failed to read secret: " + e.getMessage());
                return EXIT_INVALID;
            }
            int effectiveThreshold = threshold <= 0 ? settings.defaultThreshold() : threshold;
            if (password != null && !password.isBlank()
                    && PasswordPolicy.strength(password) == PasswordPolicy.Strength.WEAK) {
                System.err.println("WARN password is weak");
            }
            GenerationEngine engine = new GenerationEngine(
                    new ShamirSecretSharing(),
                    new OpenPgpPasswordCipher(),
                    settings,
                    parent.auditLogger(settings)
            );
            GenerationResult result;
            try {
                result = engine.generate(new GenerationRequest(secret, total, effectiveThreshold, password, !binary));
            } catch (GenerationException e) {
                System.err.println("ERROR " + e.getMessage());
                return EXIT_INVALID;
            }
            Path directory = out == null ? parent.config().exportRoot() : out;
            List<Path> written;
            try {
                written = new ShardExporter().export(result, directory);
            } catch (IOException e) {
                System.err.println("ERROR failed to write shares: " + e.getMessage());
                return EXIT_INVALID;
            }
            Map<String, Object> outcome = new LinkedHashMap<>();
            outcome.put("total", result.totalCount());
            outcome.put("threshold", result.threshold());
            outcome.put("encrypted", password != null && !password.isBlank());
            outcome.put("files", written.stream().map(Path::toString).toList());
            if (print) {
                outcome.put("tokens", result.tokens());
            }
            System.out.println(Jsons.toJson(outcome));
            return EXIT_OK;
        }

        private static String readAll(BufferedReader reader) throws IOException {
            StringBuilder out = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                out.append(line).append('\n');
            }
            return out.toString();
        }
    }

    @Command(name = "recover", description = "Recover the secret from a batch of shards")
    static final class RecoverCommand extends BatchOptions implements Callable<Integer> {
        @ParentCommand
        MnemoShardCommand parent;

        @Option(names = {"--password"}, description = "Password for the first decryption pass; later passes prompt")
        String password;

        @Option(names = {"--no-prompt"}, description = "Fail instead of prompting when encrypted shards are present")
        boolean noPrompt;

        @Override
        public Integer call() {
            RecoveryEngine engine = parent.recoveryEngine();
            RecoverySession session = fill(engine.newSession());
            PasswordPrompt prompt = noPrompt && password == null
                    ? null
                    : new ConsolePasswordPrompt(System.console(), fromStdin ? null : stdin(), System.err, password);
            DecryptionListener listener = (pass, attempts, verdict) ->
                    System.err.println("pass " + pass + ": " + verdict.message());
            try {
                RecoveredSecret recovered = engine.recover(session, prompt, listener);
                Map<String, Object> outcome = new LinkedHashMap<>();
                outcome.put("secret", recovered.secret());
                outcome.put("threshold", recovered.threshold());
                outcome.put("usableCount", recovered.usableCount());
                outcome.put("usedIndices", recovered.usedIndices());
                outcome.put("rejections", rejectionViews(session.rejections()));
                System.out.println(Jsons.toJson(outcome));
                return EXIT_OK;
            } catch (RecoveryException e) {
                Map<String, Object> outcome = new LinkedHashMap<>();
                outcome.put("error", e.error().name());
                outcome.put("message", e.getMessage());
                outcome.put("verdict", verdictView(e.verdict()));
                outcome.put("rejections", rejectionViews(session.rejections()));
                System.out.println(Jsons.toJson(outcome));
                System.err.println("ERROR " + e.getMessage());
                return e.error() == RecoveryError.CANCELLED ? EXIT_CANCELLED : EXIT_RECOVERY_FAILED;
            }
        }
    }

    @Command(name = "inspect", description = "Classify a batch of shards and report the verdict without recovering")
    static final class InspectCommand extends BatchOptions implements Callable<Integer> {
        @ParentCommand
        MnemoShardCommand parent;

        @Override
        public Integer call() {
            RecoverySession session = fill(parent.recoveryEngine().newSession());
            Map<String, Object> outcome = new LinkedHashMap<>();
            outcome.put("entries", session.entries().stream().map(MnemoShardCommand::entryView).toList());
            outcome.put("rejections", rejectionViews(session.rejections()));
            outcome.put("verdict", verdictView(session.verdict()));
            System.out.println(Jsons.toJson(outcome));
            return EXIT_OK;
        }
    }

    @Command(name = "password", description = "Check password strength or generate a random password")
    static final class PasswordCommand implements Callable<Integer> {
        @Option(names = {"--check"}, arity = "0..1", interactive = true, description = "Password to rate")
        String check;

        @Option(names = {"--generate"}, defaultValue = "0", description = "Length of a random password to generate")
        int generate;

        @Override
        public Integer call() {
            Map<String, Object> outcome = new LinkedHashMap<>();
            if (generate > 0) {
                String generated = PasswordPolicy.generate(generate);
                outcome.put("password", generated);
                outcome.put("strength", PasswordPolicy.strength(generated).name());
            } else if (check != null) {
                outcome.put("strength", PasswordPolicy.strength(check).name());
                outcome.put("score", PasswordPolicy.score(check));
            } else {
                System.err.println("ERROR use --check or --generate <length>");
                return EXIT_INVALID;
            }
            System.out.println(Jsons.toJson(outcome));
            return EXIT_OK;
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        MnemoShardCommand parent;

        @Override
        public Integer call() {
            ShardSettings settings = parent.settings();
            AuditLogger logger = parent.auditLogger(settings);
            Map<String, Object> outcome = new LinkedHashMap<>();
            outcome.put("auditFile", logger.auditFile().toString());
            try {
                outcome.put("ok", true);
                outcome.put("rows", logger.verifyChain());
                System.out.println(Jsons.toJson(outcome));
                return EXIT_OK;
            } catch (IllegalStateException e) {
                outcome.put("ok", false);
                outcome.put("error", e.getMessage());
                System.out.println(Jsons.toJson(outcome));
                return EXIT_INVALID;
            }
        }
    }
}
