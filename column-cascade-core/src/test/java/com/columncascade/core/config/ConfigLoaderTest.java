package com.columncascade.core.config;

import com.columncascade.core.model.ArtifactType;
import com.columncascade.core.model.PipelineLayer;
import com.columncascade.core.model.TypeMapping;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("cascade.yaml");
        Files.writeString(configFile, """
            lookup:
              limit: 5

            ordering:
              attributeStart: 200
              offset: 50

            technicalFields:
              - layer: gold
                name: __gold_loaded_DT
                dataType: TIMESTAMP
                order: 900
              - layer: s3
                name: __gold_grain
                dataType: STRING
                artifactType: fact
                order: 910
              - layer: gold
                name: __goldPartition_LoadYear
                dataType: INT
                order: 905
                takeToNextLevel: false

            typeMappings:
              - source_platform: sql_server
                source_data_type: NVARCHAR
                target_platform: databricks
                target_data_type: STRING
            """);

        CascadeConfig config = ConfigLoader.load(configFile);

        assertThat(config.lookup().limit()).isEqualTo(5);
        assertThat(config.ordering().attributeStart()).isEqualTo(200);
        assertThat(config.ordering().offset()).isEqualTo(50);
        assertThat(config.technicalFields()).hasSize(3);
        assertThat(config.technicalFields()).extracting(TechnicalFieldDefinition::takeToNextLevel)
            .containsExactly(true, true, false);
        assertThat(config.technicalFields()).allSatisfy(field ->
            assertThat(field.pipelineLayer()).isEqualTo(PipelineLayer.GOLD));
        assertThat(config.technicalFields().get(1).appliesTo(ArtifactType.FACT)).isTrue();
        assertThat(config.technicalFields().get(1).appliesTo(ArtifactType.DIMENSION)).isFalse();
        assertThat(config.typeMappings())
            .containsExactly(new TypeMapping("sql_server", "NVARCHAR", "databricks", "STRING"));
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("cascade.yaml");
        Files.writeString(configFile, """
            lookup:
              limit: 1
            """);

        CascadeConfig config = ConfigLoader.load(configFile);

        assertThat(config.lookup().limit()).isEqualTo(1);
        assertThat(config.ordering().attributeStart()).isEqualTo(CascadeConfig.DEFAULT_ATTRIBUTE_START);
        assertThat(config.ordering().offset()).isEqualTo(CascadeConfig.DEFAULT_ORDER_OFFSET);
        assertThat(config.technicalFields()).isEqualTo(CascadeConfig.defaultTechnicalFields());
        assertThat(config.typeMappings()).isEmpty();
    }

    @Test
    void load_negativeLimit_fallsBackToDefault() throws IOException {
        Path configFile = tempDir.resolve("cascade.yaml");
        Files.writeString(configFile, "lookup:\n  limit: -2\n");

        assertThat(ConfigLoader.load(configFile).lookup().limit()).isEqualTo(CascadeConfig.DEFAULT_LOOKUP_LIMIT);
    }

    @Test
    void load_emptyTechnicalFields_disablesInjection() throws IOException {
        Path configFile = tempDir.resolve("cascade.yaml");
        Files.writeString(configFile, "technicalFields: []\n");

        assertThat(ConfigLoader.load(configFile).technicalFields()).isEmpty();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        Path configFile = tempDir.resolve("nonexistent.yaml");

        CascadeConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CascadeConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(CascadeConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("invalid.yaml");
        Files.writeString(configFile, """
            lookup:
              limit: [unclosed
            """);

        CascadeConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CascadeConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("empty.yaml");
        Files.writeString(configFile, "");

        CascadeConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CascadeConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(CascadeConfig.defaults());
    }

    @Test
    void write_thenLoad_returnsSameConfig() throws IOException {
        CascadeConfig original = new CascadeConfig(
            new CascadeConfig.LookupConfig(2),
            new CascadeConfig.OrderingConfig(300, 10),
            List.of(new TechnicalFieldDefinition("silver", "__silver_hash", "STRING", null, 920, true)),
            List.of(new TypeMapping("oracle", "VARCHAR2", "databricks", "STRING")));
        Path configFile = tempDir.resolve("nested/cascade.yaml");

        ConfigLoader.write(original, configFile);

        assertThat(configFile).exists();
        assertThat(ConfigLoader.load(configFile)).isEqualTo(original);
    }
}
