package io.github.yok.credload.db;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.springframework.stereotype.Component;

/**
 * Connectivity check against the destination.
 */
@Component
public class DatabaseProbe {

    /**
     * Returns the server's version string.
     *
     * @param dataSource store handle
     * @return result of {@code SELECT version()}
     * @throws SQLException if the destination is unreachable or the query fails
     */
    public String version(DataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT version()")) {
            if (!rs.next()) {
                throw new SQLException("SELECT version() returned no row");
            }
            return rs.getString(1);
        }
    }
}
