package im.arun.scenebridge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final SceneBridgeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private SceneBridgeConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), SceneBridgeConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath config", configPath);
            }

            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml");
            if (resourceStream != null) {
                try (resourceStream) {
                    return yamlMapper.readValue(resourceStream, SceneBridgeConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new SceneBridgeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new SceneBridgeConfig();
        }
    }

    public SceneBridgeConfig load() {
        return load(null);
    }

    public SceneBridgeConfig load(Map<String, Object> userOptions) {
        SceneBridgeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        // Merge user options into config
        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "only_import_selected_pages":
                    case "onlyImportSelectedPages":
                        config.setOnlyImportSelectedPages(parseBoolean(value));
                        break;
                    case "only_import_images_from_selected_pages":
                    case "onlyImportImagesFromSelectedPages":
                        config.setOnlyImportImagesFromSelectedPages(parseBoolean(value));
                        break;
                    case "selected_page_ids":
                    case "selectedPageIds":
                        config.setSelectedPageIds(parseList(value));
                        break;
                    case "center_pivot":
                    case "centerPivot":
                        config.setCenterPivot(parseBoolean(value));
                        break;
                    case "apply_delta":
                    case "applyDelta":
                        config.setApplyDelta(parseBoolean(value));
                        break;
                    case "update_backups":
                    case "updateBackups":
                        config.setUpdateBackups(parseBoolean(value));
                        break;
                    case "parallel_classification":
                    case "parallelClassification":
                        config.setParallelClassification(parseBoolean(value));
                        break;
                    case "asset_root_path":
                    case "assetRootPath":
                        if (value instanceof String && !((String) value).isEmpty()) {
                            config.setAssetRootPath((String) value);
                        }
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private List<String> parseList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                result.add(String.valueOf(item));
            }
        } else if (value instanceof String) {
            for (String part : ((String) value).split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        } else {
            throw new IllegalArgumentException("Expected a list of page ids but got " + value);
        }
        return result;
    }

    private SceneBridgeConfig copyConfig(SceneBridgeConfig source) {
        SceneBridgeConfig copy = new SceneBridgeConfig();
        copy.setOnlyImportSelectedPages(source.isOnlyImportSelectedPages());
        copy.setOnlyImportImagesFromSelectedPages(source.isOnlyImportImagesFromSelectedPages());
        copy.setSelectedPageIds(new ArrayList<>(source.getSelectedPageIds()));
        copy.setCenterPivot(source.isCenterPivot());
        copy.setApplyDelta(source.isApplyDelta());
        copy.setUpdateBackups(source.isUpdateBackups());
        copy.setParallelClassification(source.isParallelClassification());
        copy.setAssetRootPath(source.getAssetRootPath());
        return copy;
    }
}
