package com.overseer.supervisors;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.overseer.AppLogger;
import com.overseer.models.Rule;
import com.overseer.models.SupervisorConfig;
import com.overseer.models.SupervisorKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Reads supervisor definitions from a YAML (or JSON) file and validates them.
 * Invalid entries are reported in the result; the valid ones still load.
 */
public class SupervisorConfigLoader {

    private static final String COMPONENT = "SupervisorConfigLoader";

    private final ObjectMapper yamlMapper;

    public SupervisorConfigLoader() {
        // YAML is a superset of JSON, so one mapper reads both
        this.yamlMapper = new YAMLMapper();
    }

    public ConfigLoadResult load(Path path) throws IOException {
        String content = Files.readString(path);
        ConfigLoadResult result = parse(content);
        AppLogger.info(COMPONENT, "Loaded " + result.getConfigs().size() + " supervisor(s) from " + path
            + (result.hasErrors() ? " with " + result.getErrors().size() + " error(s)" : ""));
        return result;
    }

    public ConfigLoadResult parse(String content) throws IOException {
        SupervisorFile file = yamlMapper.readValue(content, SupervisorFile.class);
        if (file == null || file.supervisors == null) {
            return new ConfigLoadResult(List.of(), List.of());
        }

        String project = file.project != null && !file.project.isBlank() ? file.project : "project";
        List<SupervisorConfig> valid = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < file.supervisors.size(); i++) {
            SupervisorEntry entry = file.supervisors.get(i);
            if (entry == null) {
                errors.add("Supervisor #" + (i + 1) + ": empty entry");
                continue;
            }
            SupervisorConfig config = toConfig(entry, project);
            List<String> entryErrors = validate(config);
            if (entryErrors.isEmpty()) {
                valid.add(config);
            } else {
                String label = config.getName() != null ? config.getName() : "#" + (i + 1);
                for (String error : entryErrors) {
                    errors.add("Supervisor " + label + ": " + error);
                }
            }
        }
        return new ConfigLoadResult(valid, errors);
    }

    /**
     * Human-readable problems with a config; empty when it is valid.
     */
    public static List<String> validate(SupervisorConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("Config is required");
            return errors;
        }
        if (isBlank(config.getId())) {
            errors.add("id is required");
        }
        if (isBlank(config.getName())) {
            errors.add("name is required");
        }
        if (config.getType() == null) {
            errors.add("type is required");
        }
        for (Rule rule : config.getRules()) {
            if (rule == null) {
                errors.add("Empty rule in " + config.getName());
                continue;
            }
            if (isBlank(rule.getId())) {
                errors.add("Rule without id in " + config.getName());
            }
            if (isBlank(rule.getDescription())) {
                errors.add("Rule " + rule.getId() + " has no description");
            }
            if (isBlank(rule.getCheck())) {
                errors.add("Rule " + rule.getId() + " has no check");
            }
        }
        return errors;
    }

    static String generateId(String project, String name) {
        return (project + "-" + name).toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", "-");
    }

    private SupervisorConfig toConfig(SupervisorEntry entry, String project) {
        SupervisorConfig config = new SupervisorConfig();
        config.setName(entry.name);
        if (!isBlank(entry.id)) {
            config.setId(entry.id.trim());
        } else if (!isBlank(entry.name)) {
            config.setId(generateId(project, entry.name));
        }
        config.setType(SupervisorKind.fromString(entry.type));
        if (!isBlank(entry.parent)) {
            config.setParentId(generateId(project, entry.parent));
        }
        config.setKeywords(entry.keywords);
        config.setRules(entry.rules);
        config.setEnabled(entry.enabled == null || entry.enabled);
        return config;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SupervisorFile {
        public String project;
        public String version;
        public List<SupervisorEntry> supervisors;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SupervisorEntry {
        public String id;
        public String name;
        public String type;
        public String parent;
        public List<String> keywords;
        public List<Rule> rules;
        public Boolean enabled;
    }

    public static class ConfigLoadResult {
        private final List<SupervisorConfig> configs;
        private final List<String> errors;

        public ConfigLoadResult(List<SupervisorConfig> configs, List<String> errors) {
            this.configs = Collections.unmodifiableList(new ArrayList<>(configs));
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        }

        public List<SupervisorConfig> getConfigs() {
            return configs;
        }

        public List<String> getErrors() {
            return errors;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }
}
