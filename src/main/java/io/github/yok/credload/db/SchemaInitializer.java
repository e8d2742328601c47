package io.github.yok.credload.db;

import io.github.yok.credload.config.ImportConfig;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the destination and ledger tables if they are absent.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaInitializer {

    /**
     * Issues the idempotent DDL for the profile's table and the ledger table.
     *
     * @param dataSource store handle
     * @param profile profile naming the destination table and identifier width
     * @param ledgerTable ledger table
     * @throws SQLException if a DDL statement fails
     */
    public void ensure(DataSource dataSource, ImportConfig.Profile profile, String ledgerTable)
            throws SQLException {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement()) {
            st.execute(destinationDdl(profile));
            st.execute(ledgerDdl(ledgerTable));
        }
        log.info("Schema ready (table={}, ledger={})", profile.getTable(), ledgerTable);
    }

    String destinationDdl(ImportConfig.Profile profile) {
        return "CREATE TABLE IF NOT EXISTS " + SqlIdentifiers.require(profile.getTable())
                + " (hibp_id VARCHAR(" + profile.getIdentifierLength()
                + ") NOT NULL PRIMARY KEY, password VARCHAR(200), count INT)";
    }

    String ledgerDdl(String ledgerTable) {
        return "CREATE TABLE IF NOT EXISTS " + SqlIdentifiers.require(ledgerTable)
                + " (import_id SERIAL PRIMARY KEY, name VARCHAR(200) NOT NULL,"
                + " state VARCHAR(50) NOT NULL, import_date DATE NOT NULL)";
    }
}
