package com.aiprov.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class YamlRequirementsCatalog implements RequirementsCatalog {
    private static final Logger log = LoggerFactory.getLogger(YamlRequirementsCatalog.class);

    private final Map<String, Requirement> requirements;

    YamlRequirementsCatalog(List<Requirement> requirements) {
        Map<String, Requirement> byId = new LinkedHashMap<>();
        for (Requirement requirement : requirements) {
            byId.putIfAbsent(requirement.id(), requirement);
        }
        this.requirements = byId;
    }

    public static RequirementsCatalog load(Path requirementsPath, Path mappingPath) throws IOException {
        if (requirementsPath == null || !Files.exists(requirementsPath)) {
            log.debug("No requirements file path={}", requirementsPath);
            return RequirementsCatalog.none();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        RequirementsFile file = mapper.readValue(requirementsPath.toFile(), RequirementsFile.class);
        Map<String, String> mapping = Map.of();
        if (mappingPath != null && Files.exists(mappingPath)) {
            MappingFile mappingFile = mapper.readValue(mappingPath.toFile(), MappingFile.class);
            if (mappingFile != null && mappingFile.mappings() != null) {
                mapping = mappingFile.mappings();
            }
        }

        List<Requirement> requirements = new ArrayList<>();
        if (file != null && file.requirements() != null) {
            for (RequirementEntry entry : file.requirements()) {
                if (entry == null || entry.id() == null || entry.id().isBlank()) {
                    continue;
                }
                String publicId = mapping.getOrDefault(entry.id(), entry.id());
                requirements.add(new Requirement(publicId, entry.title(), entry.status()));
            }
        }
        log.info("Loaded requirements path={} count={} mapped={}", requirementsPath, requirements.size(), mapping.size());
        return new YamlRequirementsCatalog(requirements);
    }

    @Override
    public Optional<Requirement> find(String id) {
        return Optional.ofNullable(requirements.get(id));
    }

    @Override
    public List<Requirement> all() {
        return List.copyOf(requirements.values());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RequirementsFile(List<RequirementEntry> requirements) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RequirementEntry(String id, String title, String status) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MappingFile(Map<String, String> mappings) {
    }
}
