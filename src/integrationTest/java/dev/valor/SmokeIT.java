package dev.valor;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SmokeIT extends BaseIntegrationTest {

  @Test
  void contextLoads() {
    // If we get here, Spring context loaded successfully with:
    // - Flyway migrations applied (PostGIS and raster extensions included)
    // - JPA entities mapped against the migrated schema
    // - evaluation worker pool and timeout monitor created
    assertThat(
            jdbcTemplate.queryForObject(
                "SELECT count(*) FROM pg_extension WHERE extname IN ('postgis', 'postgis_raster')",
                Integer.class))
        .isEqualTo(2);
  }
}
