package com.slack.inlet.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import com.slack.inlet.proto.config.InletConfigs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/**
 * Loads the inlet config from a yaml or json file. Yaml files may reference environment variables
 * as ${NAME}, or ${NAME:-default}.
 */
public class InletConfig {

  // Default start/stop duration for guava services.
  public static final Duration DEFAULT_START_STOP_DURATION = Duration.ofSeconds(15);

  // Parse a json string as a InletConfig proto struct.
  @VisibleForTesting
  static InletConfigs.InletConfig fromJsonConfig(String jsonStr)
      throws InvalidProtocolBufferException {
    InletConfigs.InletConfig.Builder inletConfigBuilder = InletConfigs.InletConfig.newBuilder();
    JsonFormat.parser().ignoringUnknownFields().merge(jsonStr, inletConfigBuilder);
    InletConfigs.InletConfig inletConfig = inletConfigBuilder.build();
    ValidateInletConfig.validateConfig(inletConfig);
    return inletConfig;
  }

  // Parse a yaml string as a InletConfig proto struct
  @VisibleForTesting
  static InletConfigs.InletConfig fromYamlConfig(String yamlStr)
      throws InvalidProtocolBufferException, JsonProcessingException {
    return fromYamlConfig(yamlStr, System::getenv);
  }

  @VisibleForTesting
  static InletConfigs.InletConfig fromYamlConfig(String yamlStr, StringLookup variableResolver)
      throws InvalidProtocolBufferException, JsonProcessingException {
    StringSubstitutor substitute = new StringSubstitutor(variableResolver);
    ObjectMapper yamlReader = new ObjectMapper(new YAMLFactory());
    ObjectMapper jsonWriter = new ObjectMapper();

    Object obj = yamlReader.readValue(substitute.replace(yamlStr), Object.class);
    return fromJsonConfig(jsonWriter.writeValueAsString(obj));
  }

  public static InletConfigs.InletConfig fromFile(Path cfgFilePath) throws IOException {
    if (Files.notExists(cfgFilePath)) {
      throw new IllegalArgumentException("Missing config file at: " + cfgFilePath.toAbsolutePath());
    }

    String filename = cfgFilePath.getFileName().toString();
    if (filename.endsWith(".yaml")) {
      return fromYamlConfig(Files.readString(cfgFilePath));
    } else if (filename.endsWith(".json")) {
      return fromJsonConfig(Files.readString(cfgFilePath));
    } else {
      throw new IllegalArgumentException(
          "Invalid config file format provided - must be either .json or .yaml");
    }
  }

  private InletConfig() {}
}
