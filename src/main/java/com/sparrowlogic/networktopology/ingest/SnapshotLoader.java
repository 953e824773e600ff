package com.sparrowlogic.networktopology.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a snapshot directory written by the export script into a {@link RawSnapshot}.
 *
 * <p>A missing file means nothing was exported for that resource type. A file that cannot be read or
 * parsed is logged and skipped. Only a missing snapshot directory is fatal.
 */
@Service
public class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    static final String METADATA_FILE = "metadata.json";

    private final ObjectMapper objectMapper;

    public SnapshotLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param directory snapshot directory
     * @param fallbackAccountId account id to use when {@code metadata.json} does not name one
     */
    public RawSnapshot load(Path directory, String fallbackAccountId) {
        if (!Files.isDirectory(directory)) {
            throw new SnapshotLoadException("Snapshot directory not found: " + directory);
        }
        log.info("Loading network snapshot from {}", directory);

        var accountId = Fields.str(readJson(directory.resolve(METADATA_FILE)), "aws_account_id");
        if (accountId.isEmpty() && fallbackAccountId != null) {
            accountId = fallbackAccountId;
        }

        var snapshot = new RawSnapshot(accountId);
        for (var kind : ResourceKind.values()) {
            var records = Fields.list(readJson(directory.resolve(kind.fileName())), kind.rootKey());
            if (!records.isEmpty()) {
                log.debug("Loaded {} record(s) from {}", records.size(), kind.fileName());
            }
            snapshot.add(kind, records);
        }

        for (var detail : TableDetail.values()) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, detail.filePrefix() + "*.json")) {
                for (var file : files) {
                    var fileName = file.getFileName().toString();
                    var routeTableId = fileName.substring(detail.filePrefix().length(), fileName.length() - ".json".length());
                    snapshot.addTableDetail(detail, routeTableId, Fields.list(readJson(file), detail.rootKey()));
                }
            } catch (IOException e) {
                log.warn("Could not list {} files in {}: {}", detail.filePrefix(), directory, e.getMessage());
            }
        }

        log.info("Loaded {} raw record(s) for account {}", snapshot.recordCount(),
            accountId.isEmpty() ? "<unknown>" : accountId);
        return snapshot;
    }

    private Map<String, Object> readJson(Path file) {
        if (!Files.isRegularFile(file)) {
            return Map.of();
        }
        try {
            var content = objectMapper.readValue(file.toFile(), JSON_OBJECT);
            return content != null ? content : Map.of();
        } catch (IOException e) {
            log.warn("Skipping unreadable snapshot file {}: {}", file.getFileName(), e.getMessage());
            return Map.of();
        }
    }
}
