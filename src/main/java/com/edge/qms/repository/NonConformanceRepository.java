package com.edge.qms.repository;

import com.edge.qms.model.NonConformance;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 不合格项存储，整体保存为 non-conformances.json
 */
public class NonConformanceRepository {
    private static final Logger logger = LoggerFactory.getLogger(NonConformanceRepository.class);

    private static final String FILE_NAME = "non-conformances.json";

    private final ObjectMapper objectMapper;
    private final Path file;
    private final Map<String, NonConformance> cache = new LinkedHashMap<>();

    public NonConformanceRepository(Path dataDir) {
        this.file = dataDir.resolve(FILE_NAME);
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public synchronized void load() {
        cache.clear();
        if (!Files.exists(file)) {
            logger.info("No non-conformance file at {}, starting empty", file);
            return;
        }
        try {
            List<NonConformance> items = objectMapper.readValue(file.toFile(), new TypeReference<List<NonConformance>>() {});
            items.forEach(nc -> cache.put(nc.getId(), nc));
            logger.info("Loaded {} non-conformances from {}", items.size(), file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + file, e);
        }
    }

    public synchronized NonConformance save(NonConformance nc) {
        NonConformance toSave = nc.getId() != null ? nc : nc.toBuilder().id(UUID.randomUUID().toString()).build();
        Map<String, NonConformance> next = new LinkedHashMap<>(cache);
        next.put(toSave.getId(), toSave);
        persist(next.values());
        cache.put(toSave.getId(), toSave);
        return toSave;
    }

    public synchronized Optional<NonConformance> findById(String id) {
        return Optional.ofNullable(cache.get(id));
    }

    public synchronized List<NonConformance> findAll() {
        return new ArrayList<>(cache.values());
    }

    public synchronized List<NonConformance> findByRecordId(String recordId) {
        return cache.values().stream()
                .filter(nc -> Objects.equals(recordId, nc.getRecordId()))
                .collect(Collectors.toList());
    }

    /**
     * 当年已使用的最大 NC 序号
     */
    public synchronized int maxSequenceForYear(int year) {
        String prefix = "NC-" + year + "-";
        return cache.values().stream()
                .map(NonConformance::getNcNumber)
                .filter(n -> n != null && n.startsWith(prefix))
                .mapToInt(n -> {
                    try {
                        return Integer.parseInt(n.substring(prefix.length()));
                    } catch (NumberFormatException e) {
                        return 0;
                    }
                })
                .max()
                .orElse(0);
    }

    public synchronized void delete(String id) {
        if (cache.containsKey(id)) {
            Map<String, NonConformance> next = new LinkedHashMap<>(cache);
            next.remove(id);
            persist(next.values());
            cache.remove(id);
        }
    }

    /**
     * 写入成功后才更新内存缓存
     */
    private void persist(Collection<NonConformance> items) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(FILE_NAME + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new ArrayList<>(items));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to save non-conformances to " + file, e);
        }
    }
}
