package work.lcod.scoring.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.scoring.api.LogLevel;
import work.lcod.scoring.api.ModelScorer;
import work.lcod.scoring.api.ScoreResult;
import work.lcod.scoring.deploy.DeploymentDescriptor;
import work.lcod.scoring.deploy.DeploymentLoader;
import work.lcod.scoring.report.Slf4jDiagnosticSink;
import work.lcod.scoring.session.graal.GraalJsEmbeddingService;

@CommandLine.Command(
    name = "lcod-score",
    description = "Score feature rows against a deployed model artifact.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ScoreCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-d", "--deployment"},
        required = true,
        description = "Deployment descriptor (.toml, .yaml or .json)."
    )
    private Path deploymentPath;

    @CommandLine.Option(
        names = {"-m", "--model"},
        description = "Model artifact overriding the one named by the descriptor.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path modelPath;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-|JSON",
        description = "Rows as a JSON object, array or JSON lines; '-' reads stdin.",
        defaultValue = "-"
    )
    private String input;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = "warn"
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        DeploymentDescriptor deployment = DeploymentLoader.load(deploymentPath);
        if (modelPath != null) {
            deployment = deployment.withArtifact(modelPath.toAbsolutePath().normalize());
        }
        LogLevel threshold = resolveLogLevel();
        List<Map<String, Object>> rows = parseRows(loadInputPayload());

        PrintWriter out = spec.commandLine().getOut();
        int exitCode = 0;
        try (ModelScorer scorer = new ModelScorer(
            deployment,
            new GraalJsEmbeddingService(),
            new Slf4jDiagnosticSink(threshold)
        )) {
            for (Map<String, Object> row : rows) {
                ScoreResult result = scorer.score(row);
                if (!result.isSuccess()) {
                    exitCode = 1;
                }
                out.println(JSON.writeValueAsString(result.toSerializableMap()));
            }
        }
        out.flush();
        return exitCode;
    }

    private LogLevel resolveLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private String loadInputPayload() {
        if ("-".equals(input)) {
            try {
                return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
            }
        }
        String trimmed = input.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            return trimmed;
        }
        Path path = Paths.get(input).toAbsolutePath().normalize();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + path);
        }
    }

    List<Map<String, Object>> parseRows(String payload) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (payload == null || payload.isBlank()) {
            return rows;
        }
        try (MappingIterator<JsonNode> nodes = JSON.readerFor(JsonNode.class).readValues(payload)) {
            while (nodes.hasNext()) {
                JsonNode node = nodes.next();
                if (node.isArray()) {
                    for (JsonNode element : node) {
                        rows.add(toRow(element));
                    }
                } else {
                    rows.add(toRow(node));
                }
            }
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON rows: " + ex.getMessage());
        }
        return rows;
    }

    private Map<String, Object> toRow(JsonNode node) {
        if (!node.isObject()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Each row must be a JSON object, got " + node);
        }
        Map<String, Object> row = new LinkedHashMap<>();
        node.fields().forEachRemaining(field -> row.put(field.getKey(), toValue(field.getValue())));
        return row;
    }

    private static Object toValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.toString();
    }
}
