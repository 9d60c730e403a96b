package ru.kfl.leasingsync.bot.local;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ru.kfl.leasingsync.shared.dto.action.UserActionPayload;
import ru.kfl.leasingsync.shared.store.AppendOnlyStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/** Capped action log, oldest first. Keys are positions in the retained window. */
public class JsonFileActionLog implements AppendOnlyStore<Integer, UserActionPayload, Predicate<UserActionPayload>> {

    private final Path file;
    private final ObjectMapper mapper;
    private final JavaType listType;
    private final int maxEntries;

    public JsonFileActionLog(Path file, ObjectMapper mapper, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.listType = mapper.getTypeFactory().constructCollectionType(List.class, UserActionPayload.class);
        this.maxEntries = maxEntries;
    }

    @Override
    public synchronized Optional<UserActionPayload> get(Integer position) {
        List<UserActionPayload> entries = readAll();
        if (position == null || position < 0 || position >= entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(position));
    }

    @Override
    public synchronized UserActionPayload append(UserActionPayload entry) {
        List<UserActionPayload> entries = readAll();
        entries.add(entry);
        if (entries.size() > maxEntries) {
            entries = new ArrayList<>(entries.subList(entries.size() - maxEntries, entries.size()));
        }
        JsonFileStore.writeAtomically(file, mapper, mapper.valueToTree(entries));
        return entry;
    }

    @Override
    public synchronized List<UserActionPayload> list(Predicate<UserActionPayload> filter) {
        List<UserActionPayload> entries = readAll();
        return filter == null ? entries : entries.stream().filter(filter).toList();
    }

    public synchronized ActionLogStats stats() {
        List<UserActionPayload> entries = readAll();
        int uniqueUsers = (int) entries.stream().map(UserActionPayload::telegramId).distinct().count();
        Map<String, Long> byType = entries.stream()
                .filter(e -> e.action() != null)
                .collect(Collectors.groupingBy(UserActionPayload::action, TreeMap::new, Collectors.counting()));
        return new ActionLogStats(entries.size(), uniqueUsers, byType);
    }

    private List<UserActionPayload> readAll() {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.isArray()) {
                return new ArrayList<>();
            }
            List<UserActionPayload> parsed = mapper.convertValue(root, listType);
            return new ArrayList<>(parsed);
        } catch (IOException | IllegalArgumentException e) {
            throw new LocalLogException("Cannot read " + file, e);
        }
    }
}
