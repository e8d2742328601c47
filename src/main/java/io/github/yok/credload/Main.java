package io.github.yok.credload;

import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.credload.config.ConnectionConfig;
import io.github.yok.credload.config.ImportConfig;
import io.github.yok.credload.core.ImportContext;
import io.github.yok.credload.core.ImportMode;
import io.github.yok.credload.core.ImportPipeline;
import io.github.yok.credload.core.ImportResult;
import io.github.yok.credload.db.DataSourceFactory;
import io.github.yok.credload.db.DatabaseProbe;
import io.github.yok.credload.util.ErrorHandler;
import io.github.yok.credload.util.LogicalDateParser;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Connects to the destination named by the {@code DATABASEURL} environment variable, logs its
 * version, and imports the files given on the command line with {@link ImportPipeline}.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --hibp-file FILE} or {@code -f FILE}: {@code sha1:count} file, imported with
 * {@link ImportMode#COUNT}.</li>
 * <li>{@code --hibp-passwords-file FILE} or {@code -p FILE}: {@code sha1:plaintext} file,
 * imported with {@link ImportMode#PASSWORD}.</li>
 * <li>{@code --hibp-compact-file FILE} or {@code -c FILE}: {@code sha1:count} file, imported with
 * {@link ImportMode#COMPACT}.</li>
 * <li>{@code --hibp-date DATE} or {@code -d DATE}: data vintage, e.g. {@code "November 19 2020"};
 * required when any file is given.</li>
 * </ul>
 *
 * <p>
 * {@code --name=value} is accepted as well. Without any file only the connectivity check runs.
 * Files are imported one after another in the order count, passwords, compact.
 * </p>
 *
 * <p>
 * Any fatal condition (missing configuration, unreachable destination, unreadable input, malformed
 * date) is reported through {@link ErrorHandler} and makes the process exit with code 1.
 * Data-quality errors do not change the exit code; they are visible only in the ledger.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionConfig
 * @see ImportConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, ImportConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final ImportConfig importConfig;
    private final DataSourceFactory dataSourceFactory;
    private final DatabaseProbe databaseProbe;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the code produced by {@link #run(String...)}.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        Map<ImportMode, Path> files = new EnumMap<>(ImportMode.class);
        String date = null;
        try {
            for (int i = 0; i < args.length; i++) {
                String name = args[i];
                String inline = null;
                if (name.startsWith("--") && name.contains("=")) {
                    inline = StringUtils.substringAfter(name, "=");
                    name = StringUtils.substringBefore(name, "=");
                }
                switch (name) {
                    case "--hibp-file":
                    case "-f":
                        putFile(files, ImportMode.COUNT,
                                inline != null ? inline : next(args, ++i, name));
                        break;
                    case "--hibp-passwords-file":
                    case "-p":
                        putFile(files, ImportMode.PASSWORD,
                                inline != null ? inline : next(args, ++i, name));
                        break;
                    case "--hibp-compact-file":
                    case "-c":
                        putFile(files, ImportMode.COMPACT,
                                inline != null ? inline : next(args, ++i, name));
                        break;
                    case "--hibp-date":
                    case "-d":
                        date = inline != null ? inline : next(args, ++i, name);
                        break;
                    default:
                        log.warn("Unknown argument: {}", args[i]);
                }
            }

            LocalDate logicalDate = null;
            if (!files.isEmpty()) {
                logicalDate = new LogicalDateParser(importConfig.getDateFormat()).parse(date);
                // Fail on a bad profile before any file is touched
                files.keySet().forEach(importConfig::profileFor);
            }
            log.info("Files: {}, Date: {}", files, logicalDate);

            execute(files, logicalDate);
        } catch (SQLException | RuntimeException e) {
            exitCode = 1;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void execute(Map<ImportMode, Path> files, LocalDate logicalDate) throws SQLException {
        try (HikariDataSource dataSource = dataSourceFactory.create()) {
            log.info("Connecting to PG: {}", databaseProbe.version(dataSource));

            for (Map.Entry<ImportMode, Path> entry : files.entrySet()) {
                ImportMode mode = entry.getKey();
                ImportContext context = new ImportContext(dataSource, mode,
                        importConfig.profileFor(mode), importConfig.getLedgerTable(), logicalDate);
                ImportResult result = new ImportPipeline(context).run(entry.getValue());
                log.info("hibp {} import {} records", mode.key(), result.getAccepted());
            }
        }
    }

    private static void putFile(Map<ImportMode, Path> files, ImportMode mode, String value) {
        // An empty value means "not given"
        if (StringUtils.isNotEmpty(value)) {
            files.put(mode, Paths.get(value));
        }
    }

    private static String next(String[] args, int index, String name) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + name);
        }
        return args[index];
    }
}
