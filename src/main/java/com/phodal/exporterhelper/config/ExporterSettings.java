package com.phodal.exporterhelper.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Plain {@link ExporterConfig} holding the settings common to every exporter.
 * Binds from properties such as {@code exporters.<key>.type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExporterSettings implements ExporterConfig {

    private String type;

    /**
     * Instance name. Falls back to the type when not set.
     */
    private String name;

    /**
     * Disabled exporters are refused by exporter factories.
     */
    private boolean disabled;

    @Override
    public String getName() {
        return name != null ? name : type;
    }

    public static ExporterSettings named(String name) {
        return ExporterSettings.builder()
                .name(name)
                .build();
    }
}
