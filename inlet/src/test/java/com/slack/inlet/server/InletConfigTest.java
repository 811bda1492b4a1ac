package com.slack.inlet.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.InvalidProtocolBufferException;
import com.slack.inlet.proto.config.InletConfigs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class InletConfigTest {

  private static final String YAML_CONFIG =
      """
      ingesterConfig:
        chunkConfig:
          encoding: ${CHUNK_ENCODING:-GZIP}
          blockSizeBytes: 262144
          targetSizeBytes: ${TARGET_SIZE_BYTES:-1572864}
          maxLineSizeBytes: 0
        syncPeriodSecs: ${SYNC_PERIOD_SECS:-900}
        syncMinUtilization: 0.2
        outOfOrderPolicy: REJECT
        maxReturnedErrors: 10
        flushCheckPeriodSecs: 30
      clusterConfig:
        clusterName: ${CLUSTER_NAME:-inlet_local}
        env: ${ENV:-local}
        replicaCount: 3
      defaultLimits:
        maxLocalStreamsPerUser: 5000
      tenantLimits:
        big_tenant:
          maxLocalStreamsPerUser: 100000
      unknownSection:
        ignored: true
      """;

  @TempDir Path tempDir;

  @Test
  public void testParseYamlConfig() throws IOException {
    Map<String, String> env = Map.of("SYNC_PERIOD_SECS", "60", "ENV", "prod");
    InletConfigs.InletConfig config = InletConfig.fromYamlConfig(YAML_CONFIG, env::get);

    InletConfigs.IngesterConfig ingesterConfig = config.getIngesterConfig();
    assertThat(ingesterConfig.getChunkConfig().getEncoding())
        .isEqualTo(InletConfigs.ChunkEncoding.GZIP);
    assertThat(ingesterConfig.getChunkConfig().getBlockSizeBytes()).isEqualTo(262144);
    assertThat(ingesterConfig.getChunkConfig().getTargetSizeBytes()).isEqualTo(1572864);
    assertThat(ingesterConfig.getSyncPeriodSecs()).isEqualTo(60);
    assertThat(ingesterConfig.getSyncMinUtilization()).isEqualTo(0.2);
    assertThat(ingesterConfig.getOutOfOrderPolicy())
        .isEqualTo(InletConfigs.OutOfOrderPolicy.REJECT);
    assertThat(ingesterConfig.getMaxReturnedErrors()).isEqualTo(10);
    assertThat(config.getClusterConfig().getClusterName()).isEqualTo("inlet_local");
    assertThat(config.getClusterConfig().getEnv()).isEqualTo("prod");
    assertThat(config.getClusterConfig().getReplicaCount()).isEqualTo(3);
    assertThat(config.getDefaultLimits().getMaxLocalStreamsPerUser()).isEqualTo(5000);
    assertThat(config.getTenantLimitsMap().get("big_tenant").getMaxLocalStreamsPerUser())
        .isEqualTo(100000);
  }

  @Test
  public void testParseJsonConfigWithStringNumbers() throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    ObjectNode chunkConfig =
        mapper.createObjectNode().put("blockSizeBytes", "1024").put("encoding", "NONE");
    ObjectNode ingesterConfig =
        mapper.createObjectNode().put("syncPeriodSecs", 30).set("chunkConfig", chunkConfig);
    ObjectNode node = mapper.createObjectNode();
    node.set("ingesterConfig", ingesterConfig);

    String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
    InletConfigs.InletConfig config = InletConfig.fromJsonConfig(json);
    assertThat(config.getIngesterConfig().getChunkConfig().getBlockSizeBytes()).isEqualTo(1024);
    assertThat(config.getIngesterConfig().getChunkConfig().getEncoding())
        .isEqualTo(InletConfigs.ChunkEncoding.NONE);
    assertThat(config.getIngesterConfig().getSyncPeriodSecs()).isEqualTo(30);
    assertThat(config.getIngesterConfig().getOutOfOrderPolicy())
        .isEqualTo(InletConfigs.OutOfOrderPolicy.ACCEPT);
  }

  @Test
  public void testEmptyJsonCfgFile() {
    assertThatExceptionOfType(InvalidProtocolBufferException.class)
        .isThrownBy(() -> InletConfig.fromJsonConfig(""));
  }

  @Test
  public void testInvalidConfigValues() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> InletConfig.fromJsonConfig("{}"))
        .withMessageContaining("blockSizeBytes");
    assertThatIllegalArgumentException()
        .isThrownBy(
            () ->
                InletConfig.fromJsonConfig(
                    "{\"ingesterConfig\": {\"chunkConfig\": {\"blockSizeBytes\": 1024},"
                        + " \"syncMinUtilization\": 1.5}}"))
        .withMessageContaining("syncMinUtilization");
    assertThatIllegalArgumentException()
        .isThrownBy(
            () ->
                InletConfig.fromJsonConfig(
                    "{\"ingesterConfig\": {\"chunkConfig\": {\"blockSizeBytes\": 1024,"
                        + " \"targetSizeBytes\": 10}}}"))
        .withMessageContaining("targetSizeBytes");
    assertThatIllegalArgumentException()
        .isThrownBy(
            () ->
                InletConfig.fromJsonConfig(
                    "{\"ingesterConfig\": {\"chunkConfig\": {\"blockSizeBytes\": 1024}},"
                        + " \"tenantLimits\": {\"t\": {\"maxLocalStreamsPerUser\": -1}}}"))
        .withMessageContaining("maxLocalStreamsPerUser");
  }

  @Test
  public void testFromFile() throws IOException {
    Path yamlFile = tempDir.resolve("config.yaml");
    Files.writeString(yamlFile, YAML_CONFIG);
    assertThat(InletConfig.fromFile(yamlFile).getDefaultLimits().getMaxLocalStreamsPerUser())
        .isEqualTo(5000);

    Path jsonFile = tempDir.resolve("config.json");
    Files.writeString(
        jsonFile, "{\"ingesterConfig\": {\"chunkConfig\": {\"blockSizeBytes\": 64}}}");
    InletConfigs.InletConfig jsonConfig = InletConfig.fromFile(jsonFile);
    assertThat(jsonConfig.getIngesterConfig().getChunkConfig().getBlockSizeBytes()).isEqualTo(64);
  }

  @Test
  public void testInitWithMissingConfigFile() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> InletConfig.fromFile(Path.of("missing_config_file.json")));
  }

  @Test
  public void testUnsupportedConfigFileFormat() throws IOException {
    Path txtFile = tempDir.resolve("config.txt");
    Files.writeString(txtFile, YAML_CONFIG);
    assertThatIllegalArgumentException().isThrownBy(() -> InletConfig.fromFile(txtFile));
  }
}
