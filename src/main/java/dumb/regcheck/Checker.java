package dumb.regcheck;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.regcheck.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static dumb.regcheck.util.Log.error;
import static dumb.regcheck.util.Log.message;
import static dumb.regcheck.util.Log.warning;

/**
 * Command-line entry point: checks policy files, answers compliance queries and serves JSON requests.
 */
public class Checker {

    static final String DEFAULT_DATA_DIR = "data";
    static final String DEFAULT_POLICIES_DIR = "policies";
    static final List<String> DEFAULT_TYPE_SYSTEM_FILES = List.of("types.txt");
    static final List<String> OPTIONS = List.of("dataDir", "policiesDir", "typeSystemFiles", "minRelevance");

    private final Environment env;
    private final PrintStream out;

    public Checker(Environment env, PrintStream out) {
        this.env = env;
        this.out = out;
    }

    public static void main(String[] args) {
        var code = run(args, System.in, System.out);
        if (code != 0) System.exit(code);
    }

    /** @return the process exit code */
    static int run(String[] args, InputStream in, PrintStream out) {
        String configFile = null;
        var positional = new ArrayList<String>();
        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = args[++i];
                    case "-h", "--help" -> {
                        usage(out);
                        return 0;
                    }
                    default -> {
                        if (args[i].startsWith("-")) warning("Unknown option: " + args[i]);
                        else positional.add(args[i]);
                    }
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                error("Missing argument for " + args[i - 1]);
                usage(out);
                return 1;
            }
        }
        if (positional.isEmpty()) {
            usage(out);
            return 1;
        }

        Configuration config;
        try {
            config = configFile == null ? new Configuration() : Configuration.load(Path.of(configFile));
        } catch (IOException e) {
            error("Cannot load configuration " + configFile + ": " + e.getMessage());
            return 1;
        }

        var checker = new Checker(Environment.initialize(config), out);
        var cmd = positional.get(0);
        var rest = positional.subList(1, positional.size());
        return switch (cmd) {
            case "check", "file" -> rest.size() == 1 ? checker.check(Path.of(rest.get(0))) : usage(out);
            case "query" -> rest.size() == 1 || rest.size() == 2
                    ? checker.query(rest.get(0), rest.size() == 2 ? rest.get(1) : null) : usage(out);
            case "json" -> {
                out.println(JsonBridge.handle(in, checker.env.types(), checker.env.policies().combined(), config.minRelevance()));
                yield 0;
            }
            case "json-file" -> {
                if (rest.size() != 1) yield usage(out);
                out.println(JsonBridge.handle(Path.of(rest.get(0)), checker.env.types(), checker.env.policies().combined(), config.minRelevance()));
                yield 0;
            }
            case "policies", "list" -> checker.policies();
            case "reload" -> checker.reload(rest.isEmpty() ? null : rest.get(0));
            case "inspect" -> checker.inspect();
            default -> {
                error("Unknown command: " + cmd);
                yield usage(out);
            }
        };
    }

    private static int usage(PrintStream out) {
        out.printf("Usage: java %s [-c config.json] <command>%n", Checker.class.getName());
        out.println("Commands:");
        out.println("  check <file.policy>           Parse, type-check and evaluate a policy file");
        out.println("  query \"<formula>\" [reg]       Check a query against the loaded policies");
        out.println("  json                          Answer a JSON query request read from stdin");
        out.println("  json-file <request.json>      Answer a JSON query request read from a file");
        out.println("  policies                      List the loaded policies by section");
        out.println("  reload [regulation]           Reload all policies, or one regulation");
        out.println("  inspect                       Summarize the loaded configuration");
        return 1;
    }

    /** Parse, type-check, print and evaluate a policy file. Returns 1 if it does not parse or type-check. */
    public int check(Path file) {
        out.println("Processing file: " + file + "\n");
        PolicyFile pf;
        try {
            pf = Parser.parse(Files.readString(file));
        } catch (IOException e) {
            error("Error reading file: " + e.getMessage());
            return 1;
        } catch (ParseException e) {
            out.println("  [ERROR] Parsing failed: " + e.getMessage());
            return 1;
        }
        out.println("  [STEP 1] Parsing successful.");

        var failures = TypeChecker.checkPolicyFile(pf, env.types());
        if (!failures.isEmpty()) {
            var n = failures.stream().mapToInt(f -> f.errors().size()).sum();
            out.println("  [ERROR] Type check failed: " + n + " error(s) found.");
            for (var f : failures)
                for (var e : f.errors())
                    out.println("    - Formula " + (f.index() + 1) + ": " + e.message());
            return 1;
        }
        out.println("  [STEP 2] Type check successful.");

        out.println("  [STEP 3] Formulas:");
        var policies = pf.policies();
        for (var i = 0; i < policies.size(); i++)
            out.println("    Formula " + (i + 1) + ": " + policies.get(i).toText());

        out.println("  [STEP 4] Evaluation results:");
        env.evaluator().evalPolicy(policies).forEach(r -> out.println("    " + r));
        out.println("  [SUCCESS] Full pipeline complete.");
        return 0;
    }

    /** Returns 1 if the query does not parse or type-check, 2 if a matched policy is violated. */
    public int query(String formula, @Nullable String regulation) {
        out.println("=== QUERY MODE ===\n");
        Formula q;
        try {
            q = JsonBridge.query(formula);
        } catch (ParseException e) {
            out.println("Error processing query: " + e.getMessage());
            return 1;
        }
        out.println("Query: " + q.toText() + "\n");
        try {
            var response = new QueryEngine(env.types(), env.config().minRelevance())
                    .process(q, regulation, env.evaluator(), env.policies().combined());
            out.print(response.report());
            return response.overallCompliant() ? 0 : 2;
        } catch (TypeCheckException e) {
            out.println("Error processing query: " + e.getMessage());
            return 1;
        }
    }

    public int policies() {
        var db = env.policies().combined();
        out.println("=== POLICY DATABASE ===\n");
        out.println("Total policies loaded: " + db.size() + "\n");
        for (var section : db.sections()) {
            out.println("Section: " + section);
            for (var p : db.filterBySection(section))
                out.println("  [" + p.id() + "] " + p.regulation() + " - " + p.description());
            out.println();
        }
        return 0;
    }

    public int reload(@Nullable String regulation) {
        if (regulation == null) {
            env.policies().reloadAll();
            out.println("All policies reloaded");
            return 0;
        }
        if (env.policies().reload(regulation)) {
            out.println(regulation + " policies reloaded");
            return 0;
        }
        out.println("Cannot reload " + regulation);
        return 1;
    }

    public int inspect() {
        var t = env.types();
        out.println("=== SYSTEM INSPECTION ===\n");
        out.println("Type System:");
        out.println("  Predicates: " + t.predicates().size());
        out.println("  Functions: " + t.functions().size());
        out.println("  Constants: " + t.constants().size() + "\n");
        out.println("Domain:");
        out.println("  Entities: " + env.domain().size());
        if (env.domain().size() <= 20 && env.domain().size() > 0)
            out.println("  " + String.join(", ", env.domain().entities()));
        out.println();
        out.println("Facts Database:");
        out.println("  Total facts: " + env.facts().size() + "\n");
        out.println("Policies:");
        out.println("  Total policies: " + env.policies().combined().size());
        return 0;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Configuration(
            @JsonProperty("dataDir") String dataDir,
            @JsonProperty("policiesDir") String policiesDir,
            @JsonProperty("typeSystemFiles") List<String> typeSystemFiles,
            @JsonProperty("minRelevance") double minRelevance
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("dataDir") @Nullable String dataDir,
                @JsonProperty("policiesDir") @Nullable String policiesDir,
                @JsonProperty("typeSystemFiles") @Nullable List<String> typeSystemFiles,
                @JsonProperty("minRelevance") @Nullable Double minRelevance
        ) {
            this(
                    dataDir != null ? dataDir : DEFAULT_DATA_DIR,
                    policiesDir != null ? policiesDir : DEFAULT_POLICIES_DIR,
                    typeSystemFiles != null ? typeSystemFiles : DEFAULT_TYPE_SYSTEM_FILES,
                    minRelevance != null ? minRelevance : QueryEngine.DEFAULT_MIN_SCORE
            );
        }

        public Configuration() {
            this(DEFAULT_DATA_DIR, DEFAULT_POLICIES_DIR, DEFAULT_TYPE_SYSTEM_FILES, QueryEngine.DEFAULT_MIN_SCORE);
        }

        public Configuration(String dataDir, String policiesDir, List<String> typeSystemFiles, double minRelevance) {
            this.dataDir = dataDir;
            this.policiesDir = policiesDir;
            this.typeSystemFiles = List.copyOf(typeSystemFiles);
            this.minRelevance = minRelevance;
        }

        /** Relative directories in the file are resolved against the file's own directory. */
        public static Configuration load(Path file) throws IOException {
            Configuration c;
            try {
                var tree = Json.tree(Files.readString(file));
                if (!(tree instanceof ObjectNode o))
                    throw new IOException("Invalid configuration: expected a JSON object in " + file);
                var unknown = new ArrayList<String>();
                o.fieldNames().forEachRemaining(n -> {
                    if (!OPTIONS.contains(n)) unknown.add(n);
                });
                if (!unknown.isEmpty()) {
                    warning("Ignoring unknown configuration options in " + file + ": " + unknown);
                    o.remove(unknown);
                }
                c = Json.obj(o, Configuration.class);
            } catch (JsonProcessingException e) {
                throw new IOException("Invalid configuration: " + e.getOriginalMessage(), e);
            }
            var base = file.toAbsolutePath().getParent();
            return base == null ? c : new Configuration(base.resolve(c.dataDir).toString(),
                    base.resolve(c.policiesDir).toString(), c.typeSystemFiles, c.minRelevance);
        }

        public Path data() {
            return Path.of(dataDir);
        }

        public Path policies() {
            return Path.of(policiesDir);
        }
    }

    /**
     * Everything a run needs, loaded once from a {@link Configuration}.
     */
    public record Environment(Configuration config, TypeEnvironment types, Domain domain, Facts facts,
                              FunctionTable functions, PolicyManager policies) {

        public static Environment initialize(Configuration config) {
            var data = config.data();
            var types = TypeSystemLoader.load(config.typeSystemFiles().stream().map(data::resolve).toList());
            Domain domain;
            Facts facts;
            FunctionTable functions;
            try {
                domain = DataLoader.domain(data.resolve("domain.txt"));
                facts = DataLoader.facts(data.resolve("facts.txt"));
                functions = DataLoader.functions(data.resolve("functions.txt"));
            } catch (UncheckedIOException e) {
                error("Cannot load data from " + data + ": " + e.getMessage());
                throw e;
            }
            var policies = new PolicyManager(config.policies());
            policies.reloadAll();
            message("Environment: " + types.predicates().size() + " predicates, " + domain.size() + " entities, "
                    + facts.size() + " facts");
            return new Environment(config, types, domain, facts, functions, policies);
        }

        public Evaluator evaluator() {
            return new Evaluator(domain, facts, functions);
        }
    }
}
