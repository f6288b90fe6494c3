package de.conciso.nfeimport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

@Configuration
public class ProcessorConfig {

    private static final Logger log = LoggerFactory.getLogger(ProcessorConfig.class);

    @Bean
    public ProcessorSettings processorSettings(
            @Value("${nfe.watch.xml-folder:./xml_nfe}") String xmlFolder,
            @Value("${nfe.watch.processed-folder:./processados}") String processedFolder,
            @Value("${nfe.watch.error-folder:./erros}") String errorFolder,
            @Value("${nfe.database.path:./nfe_database.db}") String databasePath,
            @Value("${nfe.watch.recursive:true}") boolean recursive,
            @Value("${nfe.watch.settle-ms:1000}") long settleMs,
            @Value("${nfe.watch.workers:4}") int workers,
            @Value("${nfe.watch.queue-capacity:1000}") int queueCapacity) {

        ProcessorSettings settings = new ProcessorSettings(
                resolve(xmlFolder),
                resolve(processedFolder),
                resolve(errorFolder),
                resolve(databasePath),
                recursive,
                Duration.ofMillis(Math.max(0, settleMs)),
                Math.max(1, workers),
                Math.max(1, queueCapacity));

        checkOutsideWatchedFolder(settings.processedFolder(), settings);
        checkOutsideWatchedFolder(settings.errorFolder(), settings);

        for (Path folder : new Path[] {settings.xmlFolder(), settings.processedFolder(), settings.errorFolder()}) {
            createFolder(folder);
        }

        log.info("XML folder: {}", settings.xmlFolder());
        log.info("Processed folder: {}", settings.processedFolder());
        log.info("Error folder: {}", settings.errorFolder());
        log.info("Database: {}", settings.databaseFile());
        log.info("Recursive search: {}", recursive ? "enabled" : "disabled");
        log.info("Settle interval: {} ms, workers: {}", settings.settleInterval().toMillis(), settings.workers());
        return settings;
    }

    @Bean
    public DataSource dataSource(ProcessorSettings settings) {
        Path parent = settings.databaseFile().getParent();
        if (parent != null) {
            createFolder(parent);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(5000);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + settings.databaseFile());
        return dataSource;
    }

    // processed and error folders must not be visible to the watch
    static void checkOutsideWatchedFolder(Path folder, ProcessorSettings settings) {
        boolean watched = settings.recursive()
                ? folder.startsWith(settings.xmlFolder())
                : folder.equals(settings.xmlFolder());
        if (watched) {
            throw new IllegalStateException("Folder " + folder + " must lie outside the watched folder "
                    + settings.xmlFolder() + (settings.recursive() ? " and its sub folders" : ""));
        }
    }

    private static Path resolve(String path) {
        return Path.of(path).toAbsolutePath().normalize();
    }

    private static void createFolder(Path folder) {
        if (Files.isDirectory(folder)) {
            return;
        }
        try {
            Files.createDirectories(folder);
            log.info("Folder created: {}", folder);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create folder " + folder, e);
        }
    }
}
