package org.carball.stackops.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.checks.CheckParameters;
import org.carball.stackops.checks.CheckRunner;
import org.carball.stackops.checks.CloudCheck;
import org.carball.stackops.checks.LoggingTicketSink;
import org.carball.stackops.checks.TicketRequest;
import org.carball.stackops.cloud.JsonFileCloudClient;
import org.carball.stackops.config.ConfigurationLoader;
import org.carball.stackops.config.OutputFormat;
import org.carball.stackops.config.QueryEngineConfig;
import org.carball.stackops.config.StackOpsConfig;
import org.carball.stackops.exception.StackOpsException;
import org.carball.stackops.model.query.QueryRequest;
import org.carball.stackops.query.QueryFactory;
import org.carball.stackops.query.QueryResult;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class StackOpsCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║           StackOps OpenStack Resource Query Tool v%s         ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (Arrays.asList(args).contains("--help-engine")) {
            System.out.println(ConfigurationLoader.getEngineHelp());
            System.exit(0);
        }
        if (Arrays.asList(args).contains("--list-checks")) {
            System.out.println(CloudCheck.getCheckHelp());
            System.exit(0);
        }
        if (args.length < 2 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 2 ? 1 : 0);
        }

        try {
            StackOpsConfig config = parseArgs(args);
            if (config.isVerbose()) {
                enableVerboseLogging();
            }
            ConfigurationLoader loader = new ConfigurationLoader();
            config.setEngineConfig(loader.loadConfiguration(config.getConfigFile(), args));

            System.out.println("\n🔍 Loading cloud snapshot...");
            System.out.println("   Snapshot file: " + config.getSnapshotFile());
            JsonFileCloudClient client = new JsonFileCloudClient(config.getSnapshotFile().toString());
            System.out.println("   Cloud: " + client.getExportMetadata().cloudName()
                    + " (exported " + client.getExportMetadata().exportTimestamp() + ")");
            System.out.println();

            QueryFactory factory = new QueryFactory(config.getEngineConfig(), Clock.systemUTC());

            if (config.isCheckMode()) {
                runCheck(config, factory, client);
            } else {
                runQuery(config, factory, client, loader);
            }

            System.out.println("\n✅ Done!");

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (StackOpsException e) {
            System.err.println("\n❌ Query error: " + e.getMessage());
            log.debug("Query error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static void runQuery(StackOpsConfig config, QueryFactory factory, JsonFileCloudClient client,
                                 ConfigurationLoader loader) throws IOException {
        QueryRequest request = loader.loadQueryRequest(config.getQueryFile());
        if (config.getGroupBy() != null) {
            request.setGroupBy(config.getGroupBy());
        }

        System.out.print("📊 Running query on " + request.getResourceType() + "... ");
        QueryResult result = factory.execute(request, client);
        System.out.println("✓ " + result.size() + " match(es)");

        QueryEngineConfig engine = config.getEngineConfig();
        OutputFormat format = config.getOutputFormat() != null ? config.getOutputFormat() : engine.getOutputFormat();
        boolean pretty = config.getPrettyPrint() != null
                ? config.getPrettyPrint()
                : request.isPrettyPrint() || engine.isPrettyPrint();

        String rendered = format == OutputFormat.JSON ? result.toJson() : result.toTable(pretty);
        writeOutput(config, rendered);

        for (String warning : result.getWarnings()) {
            System.out.println("⚠️  " + warning);
        }
    }

    private static void runCheck(StackOpsConfig config, QueryFactory factory, JsonFileCloudClient client)
            throws IOException {
        CloudCheck check = CloudCheck.fromName(config.getCheckName());
        CheckParameters parameters = CheckParameters.builder()
                .days(config.getCheckDays())
                .projectId(config.getProjectId())
                .build();

        System.out.print("🩺 Running check " + check.getName() + "... ");
        CheckRunner runner = new CheckRunner(factory, client, new LoggingTicketSink());
        List<TicketRequest> tickets = runner.run(check, parameters);
        System.out.println("✓ " + tickets.size() + " ticket(s)");

        if (config.getOutputFile() != null || config.getOutputFormat() == OutputFormat.JSON) {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
            writeOutput(config, mapper.writeValueAsString(tickets));
        } else {
            for (TicketRequest ticket : tickets) {
                System.out.println("   - " + ticket.getTitle());
            }
        }
    }

    private static void writeOutput(StackOpsConfig config, String rendered) throws IOException {
        if (config.getOutputFile() == null) {
            System.out.println();
            System.out.println(rendered);
            return;
        }
        Files.writeString(Paths.get(config.getOutputFile()), rendered);
        System.out.println("   Output file: " + config.getOutputFile());
    }

    private static void enableVerboseLogging() {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.DEBUG);
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar stackops.jar <cloud-snapshot.json> <query.yml> [options]");
        System.out.println("       java -jar stackops.jar <cloud-snapshot.json> --check <name> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  cloud-snapshot      JSON export of the cloud's resources");
        System.out.println("  query               YAML (or JSON) query: resource_type, filters, properties");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --check <name>      Run a named check instead of a query (see --list-checks)");
        System.out.println("  --days <num>        Age threshold for the check, in days");
        System.out.println("  --project <id>      Limit the check to one project");
        System.out.println("  --format, -f        Output format: table|json (default: table)");
        System.out.println("  --pretty            Draw grid borders around tables");
        System.out.println("  --group-by <prop>   Group results by a property");
        System.out.println("  --output, -o        Write output to a file instead of the console");
        System.out.println("  --config <file>     YAML file with engine settings");
        System.out.println("  --engine.* <value>  Override one engine setting (see --help-engine)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Servers not ACTIVE and not updated for 30 days");
        System.out.println("  java -jar stackops.jar snapshot.json stale-servers.yml --pretty");
        System.out.println();
        System.out.println("  # Group floating IPs by project");
        System.out.println("  java -jar stackops.jar snapshot.json fips.yml --group-by project_id");
        System.out.println();
        System.out.println("  # Snapshots older than 60 days in one project, as JSON");
        System.out.println("  java -jar stackops.jar snapshot.json --check stale-snapshots --days 60 --project p1 -f json");
    }

    static StackOpsConfig parseArgs(String[] args) {
        StackOpsConfig config = new StackOpsConfig();
        config.setSnapshotFile(Paths.get(args[0]));
        config.setVerbose(false);

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--engine.")) {
                // Value is read by ConfigurationLoader
                i++;
                continue;
            }
            switch (arg) {
                case "--check":
                    config.setCheckName(requireValue(args, ++i, "Check name not specified"));
                    break;

                case "--days":
                    String days = requireValue(args, ++i, "Number of days not specified");
                    try {
                        config.setCheckDays(Integer.parseInt(days));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid number of days: " + days);
                    }
                    break;

                case "--project":
                    config.setProjectId(requireValue(args, ++i, "Project id not specified"));
                    break;

                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, ++i, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    config.setOutputFormat(OutputFormat.fromName(requireValue(args, ++i, "Output format not specified")));
                    break;

                case "--pretty":
                    config.setPrettyPrint(true);
                    break;

                case "--group-by":
                    config.setGroupBy(requireValue(args, ++i, "Group-by property not specified"));
                    break;

                case "--config":
                    config.setConfigFile(Paths.get(requireValue(args, ++i, "Config file not specified")));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (i == 1 && !arg.startsWith("-")) {
                        config.setQueryFile(Paths.get(arg));
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static void validateConfig(StackOpsConfig config) {
        if (!Files.exists(config.getSnapshotFile())) {
            throw new IllegalArgumentException("Cloud snapshot file not found: " + config.getSnapshotFile());
        }

        if (config.isCheckMode() == (config.getQueryFile() != null)) {
            throw new IllegalArgumentException("Give exactly one of a query file or --check <name>");
        }

        if (config.getQueryFile() != null && !Files.exists(config.getQueryFile())) {
            throw new IllegalArgumentException("Query file not found: " + config.getQueryFile());
        }

        if (!config.isCheckMode() && (config.getCheckDays() != null || config.getProjectId() != null)) {
            throw new IllegalArgumentException("--days and --project only apply to --check");
        }

        if (config.getCheckDays() != null && config.getCheckDays() <= 0) {
            throw new IllegalArgumentException("--days must be positive");
        }

        if (config.getOutputFile() != null) {
            Path outputDir = Paths.get(config.getOutputFile()).toAbsolutePath().getParent();
            if (outputDir != null && !Files.exists(outputDir)) {
                throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
            }
        }
    }
}
