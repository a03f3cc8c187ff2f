package mediaflow.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Applies the bundled schema scripts to test databases.
 */
final class Schemas {

  private Schemas() {}

  static JdbcDataSource newH2DataSource() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    apply(dataSource, "/schema/h2.sql");
    return dataSource;
  }

  static void apply(DataSource dataSource, String resource) {
    String script;
    try (InputStream in = Schemas.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing schema resource " + resource);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resource, e);
    }
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      for (String statement : script.split(";")) {
        if (!statement.isBlank()) {
          st.execute(statement);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to apply " + resource, e);
    }
  }
}
