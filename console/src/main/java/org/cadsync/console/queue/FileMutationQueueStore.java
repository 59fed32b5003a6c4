package org.cadsync.console.queue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Stores the queue as a JSON array in a single file.
 * Writes go to a sibling temp file which is then moved over the target.
 */
public final class FileMutationQueueStore implements MutationQueueStore {

    private static final Logger LOG = Logger.getLogger(FileMutationQueueStore.class.getName());
    private static final TypeReference<List<MutationQueueEntry>> ENTRY_LIST = new TypeReference<List<MutationQueueEntry>>() {
    };

    private final Path file;
    private final ObjectMapper mapper;

    public FileMutationQueueStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null").toAbsolutePath();
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public List<MutationQueueEntry> load() throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return new ArrayList<>();
        }
        List<MutationQueueEntry> entries = mapper.readValue(file.toFile(), ENTRY_LIST);
        LOG.fine(() -> "[Queue] Loaded " + entries.size() + " entries from " + file);
        return entries == null ? new ArrayList<>() : entries;
    }

    @Override
    public void save(List<MutationQueueEntry> entries) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), entries);
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.fine("[Queue] Atomic move not supported, replacing file in place");
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
