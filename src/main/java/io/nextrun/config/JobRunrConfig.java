package io.nextrun.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JobRunr configuration. Provides a SQLite DataSource for the local schedule
 * store's trigger jobs; the jobrunr-spring-boot-3-starter builds the StorageProvider from it.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSource dataSource(
            @Value("${jobrunr.database.url:jdbc:sqlite:./data/jobrunr.db}") String url
    ) {
        createParentDirectory(url);
        var ds = new SQLiteDataSource();
        ds.setUrl(url);
        log.info("JobRunr SQLite DataSource configured: {}", url);
        return ds;
    }

    private static void createParentDirectory(String url) {
        if (!url.startsWith(SQLITE_PREFIX) || url.contains(":memory:")) {
            return;
        }
        Path parent = Path.of(url.substring(SQLITE_PREFIX.length())).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create JobRunr database directory: " + parent, e);
        }
    }
}
