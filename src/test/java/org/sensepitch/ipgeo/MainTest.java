package org.sensepitch.ipgeo;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * @author Jens Wilke
 */
class MainTest {

  @TempDir Path dir;

  @Test
  void configFromFile() throws IOException {
    Path file = dir.resolve("ipgeo.yaml");
    Files.writeString(file, "listen:\n  port: 8123\ndatabase:\n  directory: /srv/geo\n");
    GeoServiceConfig cfg =
        Main.readConfig(new String[] {file.toString()}, Map.of("IPGEO_LISTEN_PORT", "1"));
    assertThat(cfg.listen().port()).isEqualTo(8123);
    assertThat(cfg.database().directory()).isEqualTo("/srv/geo");
  }

  @Test
  void configFromEnvironment() throws IOException {
    GeoServiceConfig cfg = Main.readConfig(new String[0], Map.of("IPGEO_LISTEN_PORT", "8124"));
    assertThat(cfg.listen().port()).isEqualTo(8124);
  }

  @Test
  void emptyYaml_defaults() {
    assertThat(Main.readYaml(new StringReader(""))).isEqualTo(GeoServiceConfig.DEFAULT);
  }
}
