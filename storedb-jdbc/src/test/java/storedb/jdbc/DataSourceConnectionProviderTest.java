package storedb.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }

  @Test
  void borrowsFreshConnectionPerCall() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:storedb_provider;DB_CLOSE_DELAY=-1");
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);

    try (Connection first = provider.getConnection();
         Connection second = provider.getConnection()) {
      assertFalse(first.isClosed());
      assertFalse(second.isClosed());
      assertNotSame(first, second);
    }
  }
}
