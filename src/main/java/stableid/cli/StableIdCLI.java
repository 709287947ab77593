package stableid.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import stableid.StableIdException;
import stableid.batch.BatchGenerator;
import stableid.batch.BatchOptions;
import stableid.batch.BatchResult;
import stableid.codec.EidJson;
import stableid.codec.EidQueryCodec;
import stableid.codec.EidSyntaxException;
import stableid.codec.EidValidator;
import stableid.config.EidConfig;
import stableid.generator.EidGenerator;
import stableid.model.ElementIdentity;
import stableid.resolver.ResolveResult;
import stableid.resolver.ResolveStatus;
import stableid.resolver.Resolver;
import stableid.resolver.SelectorSynthesizer;
import stableid.resolver.SemanticsFilter;
import stableid.tree.JsoupTree;
import stableid.tree.SelectorException;
import stableid.tree.TreeNode;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code stableid generate} - descriptor for one element of an HTML file</li>
 *   <li>{@code stableid resolve}  - find a descriptor's element in an HTML file</li>
 *   <li>{@code stableid selector} - render a unique CSS selector for a descriptor</li>
 *   <li>{@code stableid batch}    - descriptors for every element of an HTML file</li>
 *   <li>{@code stableid validate} - structural report for a descriptor JSON file</li>
 * </ul>
 *
 * <p>Exit codes: {@value #OK} success, {@value #NOT_RESOLVED} not resolved or
 * invalid, {@value #USAGE} usage or I/O error.
 */
@Command(
        name        = "stableid",
        description = "Generate and resolve stable element identity descriptors",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                StableIdCLI.GenerateCommand.class,
                StableIdCLI.ResolveCommand.class,
                StableIdCLI.SelectorCommand.class,
                StableIdCLI.BatchCommand.class,
                StableIdCLI.ValidateCommand.class
        }
)
public class StableIdCLI implements Callable<Integer> {

    public static final int OK = 0;
    public static final int NOT_RESOLVED = 1;
    public static final int USAGE = 2;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return OK;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /** Command line with exit codes mapped; tests redirect its output with {@code setOut}/{@code setErr}. */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new StableIdCLI());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("Error: " + ex.getMessage());
            return ex instanceof IOException ? USAGE : NOT_RESOLVED;
        });
        return cmd;
    }

    // ── Shared options ──────────────────────────────────────────────────────

    /** {@code --config} override file, layered over the bundled defaults. */
    static class ConfigMixin {

        @Option(
                names       = {"-c", "--config"},
                description = "Properties file overriding stableid.properties"
        )
        Path configFile;

        EidConfig load() throws IOException {
            return configFile == null ? new EidConfig() : EidConfig.load(configFile);
        }
    }

    static JsoupTree loadHtml(Path file) throws IOException {
        if (!Files.exists(file)) throw new IOException("HTML file not found: " + file.toAbsolutePath());
        return JsoupTree.parse(file);
    }

    /** A descriptor argument: a JSON file if one exists at that path, otherwise a transport string. */
    static ElementIdentity loadDescriptor(String value) throws IOException {
        Path path = Path.of(value);
        if (!value.startsWith(EidQueryCodec.PREFIX + ":") && Files.isRegularFile(path)) {
            return EidJson.read(path);
        }
        return EidQueryCodec.decode(value);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Generates a descriptor for the first element matching a CSS selector.
     */
    @Command(
            name        = "generate",
            description = "Generate a descriptor for an element of an HTML file",
            mixinStandardHelpOptions = true
    )
    static class GenerateCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

        @Spec
        CommandSpec spec;

        @Mixin
        ConfigMixin config;

        @Parameters(index = "0", description = "HTML file")
        Path htmlFile;

        @Parameters(index = "1", description = "CSS selector of the target element")
        String selector;

        @Option(
                names        = {"-f", "--format"},
                description  = "Output format: json, query (default: json)",
                defaultValue = "json"
        )
        String format;

        @Option(
                names       = {"-o", "--output"},
                description = "Write the descriptor to this file instead of stdout"
        )
        Path output;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            if (!format.equals("json") && !format.equals("query")) {
                err.println("Unknown format: " + format + " (expected json or query)");
                return USAGE;
            }

            JsoupTree tree = loadHtml(htmlFile);
            TreeNode target;
            try {
                target = tree.selectFirst(selector);
            } catch (SelectorException e) {
                err.println("Invalid CSS selector: " + selector);
                return USAGE;
            }
            if (target == null) {
                err.println("No element matches: " + selector);
                return NOT_RESOLVED;
            }

            EidConfig cfg = config.load();
            Optional<ElementIdentity> eid = new EidGenerator(cfg.generatorOptions().build()).generate(target);
            if (eid.isEmpty()) {
                err.println("No descriptor could be generated for: " + selector);
                return NOT_RESOLVED;
            }
            log.info("Generated descriptor for <{}> with confidence {}", eid.get().target().tag(),
                    String.format("%.2f", eid.get().confidence()));

            String text = format.equals("query") ? EidQueryCodec.encode(eid.get()) : EidJson.toJson(eid.get());
            if (output != null) {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.writeString(output, text);
                out.println("Descriptor written to " + output.toAbsolutePath());
            } else {
                out.println(text);
            }
            return OK;
        }
    }

    /**
     * Resolves a descriptor against an HTML file.
     */
    @Command(
            name        = "resolve",
            description = "Find the element a descriptor identifies in an HTML file",
            mixinStandardHelpOptions = true
    )
    static class ResolveCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Mixin
        ConfigMixin config;

        @Parameters(index = "0", description = "HTML file")
        Path htmlFile;

        @Parameters(index = "1", description = "Descriptor JSON file or transport string (v1: ...)")
        String descriptor;

        @Option(names = "--strict", description = "Do not pick among multiple matches")
        boolean strict;

        @Option(names = "--require-unique", description = "Fail when more than one element matches")
        boolean requireUnique;

        @Option(names = "--no-fallback", description = "Do not apply the descriptor's fallback rules")
        boolean noFallback;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            JsoupTree tree = loadHtml(htmlFile);
            ElementIdentity eid;
            try {
                eid = loadDescriptor(descriptor);
            } catch (EidSyntaxException | EidJson.SchemaValidationException | EidJson.SchemaVersionException
                     | JsonProcessingException e) {
                err.println("Invalid descriptor: " + e.getMessage());
                return NOT_RESOLVED;
            }

            EidConfig cfg = config.load();
            var builder = cfg.resolverOptions();
            if (strict) builder.strictMode(true);
            if (requireUnique) builder.requireUniqueness(true);
            if (noFallback) builder.enableFallback(false);

            ResolveResult result = new Resolver(builder.build()).resolve(eid, tree.root());
            out.printf("Status     : %s%n", result.status().code());
            out.printf("Confidence : %.2f%n", result.confidence());
            if (result.reason() != null) out.printf("Reason     : %s%n", result.reason().code());
            for (String warning : result.warnings()) out.printf("Warning    : %s%n", warning);
            for (TreeNode match : result.matches()) out.printf("Match      : %s%n", match);

            boolean resolved = !result.matches().isEmpty()
                    && result.status() != ResolveStatus.ERROR
                    && result.status() != ResolveStatus.DEGRADED_FALLBACK;
            return resolved ? OK : NOT_RESOLVED;
        }
    }

    /**
     * Prints the most specific selector the descriptor yields in an HTML file.
     */
    @Command(
            name        = "selector",
            description = "Render a unique CSS selector for a descriptor",
            mixinStandardHelpOptions = true
    )
    static class SelectorCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Mixin
        ConfigMixin config;

        @Parameters(index = "0", description = "HTML file")
        Path htmlFile;

        @Parameters(index = "1", description = "Descriptor JSON file or transport string (v1: ...)")
        String descriptor;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            JsoupTree tree = loadHtml(htmlFile);
            ElementIdentity eid;
            try {
                eid = loadDescriptor(descriptor);
            } catch (EidSyntaxException | EidJson.SchemaValidationException | EidJson.SchemaVersionException
                     | JsonProcessingException e) {
                err.println("Invalid descriptor: " + e.getMessage());
                return NOT_RESOLVED;
            }

            int maxClasses = config.load().resolverOptions().build().getMaxSelectorClasses();
            SelectorSynthesizer.SelectorResult result =
                    new SelectorSynthesizer(maxClasses, new SemanticsFilter()).synthesize(eid, tree.root());
            out.println(result.selector());
            if (!result.unique()) {
                err.println("Selector is not unique in " + htmlFile.getFileName());
                return NOT_RESOLVED;
            }
            return OK;
        }
    }

    /**
     * Generates descriptors for every element of an HTML file.
     */
    @Command(
            name        = "batch",
            description = "Generate descriptors for all elements of an HTML file",
            mixinStandardHelpOptions = true
    )
    static class BatchCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

        @Spec
        CommandSpec spec;

        @Mixin
        ConfigMixin config;

        @Parameters(index = "0", description = "HTML file")
        Path htmlFile;

        @Option(names = {"-l", "--limit"}, description = "Maximum number of elements to process")
        Integer limit;

        @Option(names = "--all", description = "Include elements without semantic features")
        boolean all;

        @Option(
                names       = {"-o", "--output"},
                description = "Write the results to this file instead of stdout"
        )
        Path output;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();

            JsoupTree tree = loadHtml(htmlFile);
            EidConfig cfg = config.load();
            BatchOptions.Builder options = BatchOptions.builder()
                    .skipNonSemantic(!all)
                    .progressInterval(cfg.getProgressInterval())
                    .progressListener((done, total) -> log.debug("Batch progress {}/{}", done, total));
            if (limit != null) options.limit(limit);

            BatchGenerator generator = new BatchGenerator(cfg.generatorOptions().cache(cfg.newCache()).build());
            BatchResult result = generator.generate(tree.root(), options.build());

            ObjectMapper mapper = EidJson.getMapper();
            ObjectNode report = mapper.createObjectNode();
            report.set("stats", mapper.valueToTree(result.stats()));
            ArrayNode results = report.putArray("results");
            for (BatchResult.Entry entry : result.results()) {
                ObjectNode item = results.addObject();
                item.put("element", entry.node().toString());
                item.put("query", EidQueryCodec.encode(entry.eid()));
                item.set("eid", mapper.valueToTree(entry.eid()));
            }
            ArrayNode failed = report.putArray("failed");
            for (BatchResult.Failure failure : result.failed()) {
                failed.addObject().put("element", failure.node().toString()).put("error", failure.error());
            }

            String json = mapper.writeValueAsString(report);
            if (output != null) {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.writeString(output, json);
                out.printf("%d descriptor(s) written to %s%n", result.stats().generated(), output.toAbsolutePath());
            } else {
                out.println(json);
            }
            return result.failed().isEmpty() ? OK : NOT_RESOLVED;
        }
    }

    /**
     * Validates a descriptor JSON file against the schema and structural rules.
     */
    @Command(
            name        = "validate",
            description = "Check a descriptor JSON file",
            mixinStandardHelpOptions = true
    )
    static class ValidateCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Descriptor JSON file")
        Path descriptorFile;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            if (!Files.exists(descriptorFile)) {
                throw new IOException("Descriptor file not found: " + descriptorFile.toAbsolutePath());
            }

            ElementIdentity eid;
            try {
                eid = EidJson.read(descriptorFile);
            } catch (StableIdException | JsonProcessingException e) {
                out.println("INVALID");
                out.println("  error: " + e.getMessage().trim());
                return NOT_RESOLVED;
            }

            EidValidator.ValidationResult result = EidValidator.validate(eid);
            out.println(result.valid() ? "VALID" : "INVALID");
            result.errors().forEach(e -> out.println("  error: " + e));
            result.warnings().forEach(w -> out.println("  warning: " + w));
            return result.valid() ? OK : NOT_RESOLVED;
        }
    }
}
