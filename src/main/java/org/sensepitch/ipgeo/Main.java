package org.sensepitch.ipgeo;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.sensepitch.ipgeo.config.EnvInjector;
import org.sensepitch.ipgeo.config.RecordConstructor;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.nodes.Node;

/**
 * Starts the service. The configuration is read from the YAML file given as first argument, or,
 * without argument, from environment variables prefixed with {@value
 * GeoServiceConfig#ENV_PREFIX}.
 *
 * @author Jens Wilke
 */
@Slf4j
public class Main {

  public static void main(String[] args) throws Exception {
    GeoServiceConfig config = readConfig(args, System.getenv());
    try {
      new GeoServer(config).start();
    } catch (DatabaseLoadException e) {
      log.error("Cannot load databases, exiting: " + e.getMessage(), e);
      System.exit(1);
    }
  }

  static GeoServiceConfig readConfig(String[] args, Map<String, String> env) throws IOException {
    if (args.length > 0) {
      try (Reader reader = Files.newBufferedReader(Path.of(args[0]))) {
        return readYaml(reader);
      }
    }
    return (GeoServiceConfig)
        EnvInjector.injectFromEnv(GeoServiceConfig.ENV_PREFIX, env, GeoServiceConfig.builder());
  }

  static GeoServiceConfig readYaml(Reader reader) {
    Node root = new Yaml().compose(reader);
    if (root == null) {
      return GeoServiceConfig.DEFAULT;
    }
    return RecordConstructor.construct(GeoServiceConfig.class, root);
  }
}
