package io.mindprint.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mindprint.core.config.model.MindprintConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@code config.json} merged over {@link MindprintConfig#defaults()}, then applies
 * {@code MINDPRINT_*} environment overrides.
 */
public final class ConfigService {
    public static final String ENV_USER_ID = "MINDPRINT_USER_ID";
    public static final String ENV_DB_PATH = "MINDPRINT_DB_PATH";
    public static final String ENV_TOKEN_NAMESPACE = "MINDPRINT_TOKEN_NAMESPACE";

    private final ObjectMapper mapper;
    private final Map<String, String> env;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> env) {
        this.env = Map.copyOf(Objects.requireNonNull(env, "env must not be null"));
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public MindprintConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return applyEnvironment(MindprintConfig.defaults());
        }

        JsonNode defaultsNode = mapper.valueToTree(MindprintConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return applyEnvironment(mapper.treeToValue(merged, MindprintConfig.class));
    }

    public void save(Path configPath, MindprintConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        MindprintConfig config;
        if (created || overwrite) {
            config = MindprintConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = readFileOnly(configPath);
        }

        save(configPath, config);

        Path storePath = ConfigPaths.resolve(applyEnvironment(config).store().path());
        Path parent = storePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new OnboardResult(configPath, storePath, created, overwritten);
    }

    public String toPrettyJson(MindprintConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    // Environment values are not persisted back by onboard.
    private MindprintConfig readFileOnly(Path configPath) throws IOException {
        JsonNode defaultsNode = mapper.valueToTree(MindprintConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        return mapper.treeToValue(deepMerge(defaultsNode, existingNode), MindprintConfig.class);
    }

    private MindprintConfig applyEnvironment(MindprintConfig config) {
        MindprintConfig result = config;
        String userId = env.get(ENV_USER_ID);
        if (userId != null && !userId.isBlank()) {
            result = result.withUserId(userId.strip());
        }
        String dbPath = env.get(ENV_DB_PATH);
        if (dbPath != null && !dbPath.isBlank()) {
            result = result.withStore(result.store().withPath(dbPath.strip()));
        }
        String namespace = env.get(ENV_TOKEN_NAMESPACE);
        if (namespace != null && !namespace.isBlank()) {
            result = result.withRental(result.rental().withNamespace(namespace.strip()));
        }
        return result;
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
