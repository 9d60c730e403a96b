package ru.kfl.leasingsync.bot.local;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.kfl.leasingsync.shared.error.NotFoundException;
import ru.kfl.leasingsync.shared.error.ValidationFailedException;
import ru.kfl.leasingsync.shared.store.DeletableStore;
import ru.kfl.leasingsync.shared.store.UpsertOutcome;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Keyed entities in one JSON document, {@code {"updated_at": ..., "items": [...]}}.
 * Every write goes through a temp file and an atomic rename.
 */
public class JsonFileStore<K, E> implements DeletableStore<K, E, Predicate<E>> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final JavaType listType;
    private final Function<E, K> keyOf;

    public JsonFileStore(Path file, ObjectMapper mapper, Class<E> entityType, Function<E, K> keyOf) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.listType = mapper.getTypeFactory().constructCollectionType(List.class, entityType);
        this.keyOf = Objects.requireNonNull(keyOf, "keyOf");
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized Optional<E> get(K key) {
        return readAll().stream()
                .filter(e -> Objects.equals(keyOf.apply(e), key))
                .findFirst();
    }

    @Override
    public synchronized UpsertOutcome<E> upsert(E entity) {
        List<E> items = readAll();
        UpsertOutcome<E> outcome = put(items, entity);
        writeAll(items);
        return outcome;
    }

    /** Upserts all entities with a single file write. */
    public synchronized List<UpsertOutcome<E>> upsertAll(Collection<E> entities) {
        List<E> items = readAll();
        List<UpsertOutcome<E>> outcomes = new ArrayList<>(entities.size());
        for (E entity : entities) {
            outcomes.add(put(items, entity));
        }
        writeAll(items);
        return outcomes;
    }

    @Override
    public synchronized E update(E entity) {
        K key = keyOf.apply(entity);
        List<E> items = readAll();
        for (int i = 0; i < items.size(); i++) {
            if (Objects.equals(key, keyOf.apply(items.get(i)))) {
                items.set(i, entity);
                writeAll(items);
                return entity;
            }
        }
        throw new NotFoundException("no entry for key " + key);
    }

    @Override
    public synchronized boolean delete(K key) {
        List<E> items = readAll();
        boolean removed = items.removeIf(e -> Objects.equals(keyOf.apply(e), key));
        if (removed) {
            writeAll(items);
        }
        return removed;
    }

    @Override
    public synchronized List<E> list(Predicate<E> filter) {
        List<E> items = readAll();
        return filter == null ? items : items.stream().filter(filter).toList();
    }

    private UpsertOutcome<E> put(List<E> items, E entity) {
        K key = keyOf.apply(entity);
        if (key == null) {
            throw new ValidationFailedException("entity key is required");
        }
        for (int i = 0; i < items.size(); i++) {
            if (key.equals(keyOf.apply(items.get(i)))) {
                items.set(i, entity);
                return UpsertOutcome.updated(entity);
            }
        }
        items.add(entity);
        return UpsertOutcome.created(entity);
    }

    private List<E> readAll() {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            JsonNode items = root != null && root.isObject() ? root.get("items") : root;
            if (items == null || items.isNull() || items.isMissingNode()) {
                return new ArrayList<>();
            }
            List<E> parsed = mapper.convertValue(items, listType);
            return new ArrayList<>(parsed);
        } catch (IOException | IllegalArgumentException e) {
            throw new LocalLogException("Cannot read " + file, e);
        }
    }

    private void writeAll(List<E> items) {
        ObjectNode document = mapper.createObjectNode();
        document.put("updated_at", Instant.now().toString());
        document.set("items", mapper.valueToTree(items));
        writeAtomically(file, mapper, document);
        log.debug("Wrote {} items to {}", items.size(), file);
    }

    static void writeAtomically(Path target, ObjectMapper mapper, JsonNode document) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new LocalLogException("Cannot write " + target, e);
        }
    }
}
