package org.carball.stackops.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.model.query.QueryRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public QueryEngineConfig loadConfiguration(Path yamlFile, String[] args) {
        log.debug("Loading configuration");

        // Start with the file, or defaults
        QueryEngineConfig.QueryEngineConfigBuilder builder = loadYaml(yamlFile).toBuilder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        QueryEngineConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    public QueryEngineConfig loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Reads a query request (resource type, filters, properties, grouping) from a YAML or JSON file.
     */
    public QueryRequest loadQueryRequest(Path queryFile) throws IOException {
        if (!Files.exists(queryFile)) {
            throw new IOException("Query file not found: " + queryFile);
        }
        QueryRequest request = yamlMapper.readValue(queryFile.toFile(), QueryRequest.class);
        log.info("Loaded query for {} from: {}", request.getResourceType(), queryFile);
        return request;
    }

    private QueryEngineConfig loadYaml(Path yamlFile) {
        if (yamlFile == null) {
            return QueryEngineConfig.defaults();
        }
        if (!Files.exists(yamlFile)) {
            log.warn("Engine config file not found: {}, using defaults", yamlFile);
            return QueryEngineConfig.defaults();
        }

        try {
            QueryEngineConfig config = yamlMapper.readValue(yamlFile.toFile(), QueryEngineConfig.class);
            log.info("Loaded engine configuration from: {}", yamlFile);
            return config == null ? QueryEngineConfig.defaults() : config;
        } catch (IOException e) {
            log.error("Failed to load engine config from {}: {}, using defaults", yamlFile, e.getMessage());
            return QueryEngineConfig.defaults();
        }
    }

    private void applyEnvironmentVariables(QueryEngineConfig.QueryEngineConfigBuilder builder) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String option = switch (entry.getKey()) {
                case "STACKOPS_SERVER_SIDE_FILTERS" -> "--engine.server-side-filters";
                case "STACKOPS_VERIFY_SERVER_SIDE_FILTERS" -> "--engine.verify-server-side-filters";
                case "STACKOPS_MAX_LISTING_CALLS" -> "--engine.max-listing-calls";
                case "STACKOPS_DATETIME_FORMAT" -> "--engine.datetime-format";
                case "STACKOPS_PRETTY_PRINT" -> "--engine.pretty-print";
                case "STACKOPS_OUTPUT_FORMAT" -> "--engine.output-format";
                case "STACKOPS_DELETING_MACHINE_MINUTES" -> "--engine.deleting-machine-minutes";
                case "STACKOPS_STALE_SNAPSHOT_DAYS" -> "--engine.stale-snapshot-days";
                case "STACKOPS_DOWN_FLOATING_IP_DAYS" -> "--engine.down-floating-ip-days";
                default -> null;
            };
            if (option != null) {
                apply(builder, option, entry.getValue(), entry.getKey());
            }
        }
    }

    private void applyCLIArguments(QueryEngineConfig.QueryEngineConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].startsWith("--engine.")) {
                apply(builder, args[i], args[i + 1], args[i]);
            }
        }
    }

    private void apply(QueryEngineConfig.QueryEngineConfigBuilder builder, String option, String value,
                       String source) {
        try {
            switch (option) {
                case "--engine.server-side-filters":
                    builder.serverSideFilters(parseBoolean(value));
                    break;
                case "--engine.verify-server-side-filters":
                    builder.verifyServerSideFilters(parseBoolean(value));
                    break;
                case "--engine.max-listing-calls":
                    builder.maxListingCalls(Integer.parseInt(value));
                    break;
                case "--engine.datetime-format":
                    builder.dateTimeFormat(value);
                    break;
                case "--engine.pretty-print":
                    builder.prettyPrint(parseBoolean(value));
                    break;
                case "--engine.output-format":
                    builder.outputFormat(OutputFormat.fromName(value));
                    break;
                case "--engine.deleting-machine-minutes":
                    builder.deletingMachineMinutes(Integer.parseInt(value));
                    break;
                case "--engine.stale-snapshot-days":
                    builder.staleSnapshotDays(Integer.parseInt(value));
                    break;
                case "--engine.down-floating-ip-days":
                    builder.downFloatingIpDays(Integer.parseInt(value));
                    break;
                default:
                    log.warn("Ignoring unknown engine option {}", option);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}: {}", source, e.getMessage());
        }
    }

    private static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        throw new IllegalArgumentException("expected true or false, got '" + value + "'");
    }

    /**
     * Returns help text for engine configuration options.
     */
    public static String getEngineHelp() {
        return """
            Engine Configuration Options:

            CLI Arguments:
              --engine.server-side-filters <bool>         Push supported filters into listing calls (default: true)
              --engine.verify-server-side-filters <bool>  Re-check pushed filters locally (default: true)
              --engine.max-listing-calls <num>            Max listing calls one query may fan out to (default: 20)
              --engine.datetime-format <pattern>          Timestamp pattern for datetime filters
              --engine.pretty-print <bool>                Grid tables instead of plain ones
              --engine.output-format <table|json>         Default output format
              --engine.deleting-machine-minutes <num>     deleting-machines check threshold (default: 10)
              --engine.stale-snapshot-days <num>          stale-snapshots check threshold (default: 30)
              --engine.down-floating-ip-days <num>        down-floating-ips check threshold (default: 7)

            Environment Variables:
              STACKOPS_SERVER_SIDE_FILTERS                Same as --engine.server-side-filters
              STACKOPS_VERIFY_SERVER_SIDE_FILTERS         Same as --engine.verify-server-side-filters
              STACKOPS_MAX_LISTING_CALLS                  Same as --engine.max-listing-calls
              STACKOPS_DATETIME_FORMAT                    Same as --engine.datetime-format
              STACKOPS_PRETTY_PRINT                       Same as --engine.pretty-print
              STACKOPS_OUTPUT_FORMAT                      Same as --engine.output-format
              STACKOPS_DELETING_MACHINE_MINUTES           Same as --engine.deleting-machine-minutes
              STACKOPS_STALE_SNAPSHOT_DAYS                Same as --engine.stale-snapshot-days
              STACKOPS_DOWN_FLOATING_IP_DAYS              Same as --engine.down-floating-ip-days

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file given with --config
              4. Built-in defaults
            """;
    }
}
