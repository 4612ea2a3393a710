package fr.lapetina.fleet.layout.infrastructure.config;

import fr.lapetina.fleet.layout.domain.model.ServiceRole;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of the layout generator application.
 * Designed to be populated from YAML.
 */
public class GenconfigConfig {

    private Map<String, String> images = new LinkedHashMap<>();
    private OutputConfig output = new OutputConfig();

    // Getters and Setters
    public Map<String, String> getImages() { return images; }
    public void setImages(Map<String, String> images) { this.images = images; }

    public OutputConfig getOutput() { return output; }
    public void setOutput(OutputConfig output) { this.output = output; }

    /**
     * Default images keyed by service role. Fleet descriptions may override
     * them per service.
     *
     * @throws GenconfigConfigLoader.ConfigurationException for an unknown service name or a missing image
     */
    public Map<ServiceRole, String> defaultImages() {
        Map<ServiceRole, String> byRole = new EnumMap<>(ServiceRole.class);
        if (images == null) {
            return byRole;
        }
        for (Map.Entry<String, String> entry : images.entrySet()) {
            ServiceRole role = ServiceRole.fromServiceName(entry.getKey())
                    .orElseThrow(() -> new GenconfigConfigLoader.ConfigurationException(
                            "images[" + entry.getKey() + "]: invalid service name"));
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new GenconfigConfigLoader.ConfigurationException(
                        "images[" + entry.getKey() + "]: image is required");
            }
            byRole.put(role, entry.getValue());
        }
        return byRole;
    }

    /**
     * Where and how generated layouts are written.
     */
    public static class OutputConfig {
        private String directory;
        private boolean summary = true;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public boolean isSummary() { return summary; }
        public void setSummary(boolean summary) { this.summary = summary; }
    }
}
