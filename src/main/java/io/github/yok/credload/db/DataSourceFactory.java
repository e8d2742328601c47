package io.github.yok.credload.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.credload.config.ConnectionConfig;
import io.github.yok.credload.util.DatabaseUrlResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Builds the process-wide connection pool from {@link ConnectionConfig}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataSourceFactory {

    private final ConnectionConfig connectionConfig;

    /**
     * Creates a pool. The caller owns it and must close it.
     *
     * @return connection pool
     * @throws IllegalArgumentException if the connection URL is missing or malformed
     */
    public HikariDataSource create() {
        DatabaseUrlResolver.Resolved resolved =
                DatabaseUrlResolver.resolve(connectionConfig.getUrl());

        HikariConfig config = new HikariConfig();
        config.setPoolName("credload");
        config.setJdbcUrl(resolved.getJdbcUrl());
        config.setUsername(StringUtils.firstNonBlank(connectionConfig.getUser(),
                resolved.getUser()));
        config.setPassword(StringUtils.firstNonBlank(connectionConfig.getPassword(),
                resolved.getPassword()));
        if (StringUtils.isNotBlank(connectionConfig.getDriverClass())) {
            config.setDriverClassName(connectionConfig.getDriverClass());
        }
        config.setMaximumPoolSize(connectionConfig.getMaximumPoolSize());
        config.setAutoCommit(true);

        log.info("Connecting to {}", resolved.getJdbcUrl());
        return new HikariDataSource(config);
    }
}
