package com.ryuqq.lifecycle.adapter.file.store;

import com.ryuqq.lifecycle.adapter.file.codec.FeatureRecordCodec;
import com.ryuqq.lifecycle.core.exception.CorruptRecordException;
import com.ryuqq.lifecycle.core.exception.FeatureNotFoundException;
import com.ryuqq.lifecycle.core.exception.PersistenceException;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.model.FeatureSlug;
import com.ryuqq.lifecycle.core.spi.FeatureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * YAML file implementation of {@link FeatureStore}.
 *
 * <p>Each feature lives in {@code <root>/<slug>.yaml}. A save writes the whole record to a
 * temporary file in the same directory and moves it over the target, so a reader sees
 * either the previous record or the new one.</p>
 *
 * <p><strong>Behaviour:</strong></p>
 * <ul>
 *   <li>Atomic replace via {@link StandardCopyOption#ATOMIC_MOVE}, plain replace where the
 *       file system does not support it</li>
 *   <li>Single writer assumed; concurrent saves of one slug are last-writer-wins</li>
 *   <li>Legacy records are migrated on load; the file is rewritten only on the next save</li>
 *   <li>Files whose name starts with '.' (temporary files) are ignored</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class FileFeatureStore implements FeatureStore {

    private static final Logger log = LoggerFactory.getLogger(FileFeatureStore.class);

    static final String EXTENSION = ".yaml";

    private final Path root;
    private final FeatureRecordCodec codec;

    public FileFeatureStore(Path root) {
        this(root, new FeatureRecordCodec());
    }

    public FileFeatureStore(Path root, FeatureRecordCodec codec) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.root = root;
        this.codec = codec;
    }

    @Override
    public FeatureRecord load(String slug) {
        Path path = pathFor(slug);
        String yaml;
        try {
            yaml = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new FeatureNotFoundException(slug);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + path, e);
        }
        return decode(path, slug, yaml);
    }

    @Override
    public void save(FeatureRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Path target = pathFor(record.slug());
        String yaml = codec.encode(record);

        Path temp = null;
        try {
            Files.createDirectories(root);
            temp = Files.createTempFile(root, "." + record.slug() + "-", ".tmp");
            Files.writeString(temp, yaml, StandardCharsets.UTF_8);
            move(temp, target);
            temp = null;
            log.debug("Saved feature {} (phase={}) to {}", record.slug(), record.currentPhase(), target);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write " + target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    @Override
    public boolean exists(String slug) {
        return Files.isRegularFile(pathFor(slug));
    }

    @Override
    public List<FeatureRecord> findByProduct(String productId) {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be null or blank");
        }
        if (!Files.isDirectory(root)) {
            return List.of();
        }

        List<FeatureRecord> found = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(root, "[!.]*" + EXTENSION)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String slug = name.substring(0, name.length() - EXTENSION.length());
                FeatureRecord record = decode(file, slug, Files.readString(file, StandardCharsets.UTF_8));
                if (record.productId().equals(productId)) {
                    found.add(record);
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list " + root, e);
        }
        found.sort(Comparator.comparing(FeatureRecord::slug));
        return found;
    }

    public Path getRoot() {
        return root;
    }

    private FeatureRecord decode(Path path, String slug, String yaml) {
        FeatureRecord record = codec.decode(path.toString(), yaml);
        if (!record.slug().equals(slug)) {
            throw new CorruptRecordException(path.toString(),
                "Record slug '" + record.slug() + "' does not match file name", null);
        }
        return record;
    }

    private Path pathFor(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug cannot be null or blank");
        }
        // slug pattern keeps the path inside root
        FeatureSlug.of(slug);
        return root.resolve(slug + EXTENSION);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}", temp, e);
        }
    }
}
