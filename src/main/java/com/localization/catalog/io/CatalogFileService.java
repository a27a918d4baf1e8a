package com.localization.catalog.io;

import com.localization.catalog.model.Catalog;
import com.localization.catalog.parser.PoParser;
import com.localization.catalog.parser.exception.CatalogParseException;
import com.localization.catalog.serializer.PoSerializer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes PO/POT files. Files are UTF-8.
 */
public class CatalogFileService {
    private static final Logger log = LoggerFactory.getLogger(CatalogFileService.class);

    private final PoSerializer serializer;

    public CatalogFileService() {
        this(new PoSerializer());
    }

    public CatalogFileService(PoSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * @throws CatalogFileException if the file is not a valid catalog
     */
    public Catalog read(Path path) throws IOException {
        log.debug("Parsing catalog: {}", path);
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return PoParser.parseString(content);
        } catch (CatalogParseException e) {
            throw new CatalogFileException(path, e);
        }
    }

    public Optional<Catalog> readIfExists(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path));
    }

    public void write(Path path, Catalog catalog) throws IOException {
        FileWriteUtil.safeWriteString(path, serializer.serialize(catalog));
        log.debug("Wrote {} entries to {}", catalog.getEntries().size(), path);
    }
}
