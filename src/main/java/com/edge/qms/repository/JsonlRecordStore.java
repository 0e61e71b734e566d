package com.edge.qms.repository;

import com.edge.qms.model.DateRange;
import com.edge.qms.model.InspectionRecord;
import com.edge.qms.model.MeasurementItem;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于 JSON Lines 的本地记录存储
 * <p>
 * 目录结构：
 * - records/2024-01-15.jsonl    按创建日期分文件，每行一条记录
 * - id_index.txt                ID -> 日期映射（格式: id,日期）
 * - template_index/{模板ID}.txt  模板下的记录索引（格式: id,日期）
 * <p>
 * 由调用方显式创建并通过 open()/close() 管理生命周期；单写多读。
 */
public class JsonlRecordStore implements RecordStore, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JsonlRecordStore.class);

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final Gson gson = new GsonBuilder()
            .registerTypeAdapter(LocalDateTime.class, (JsonSerializer<LocalDateTime>) (src, type, context) ->
                    new JsonPrimitive(src.format(ISO_FORMATTER)))
            .registerTypeAdapter(LocalDateTime.class, (JsonDeserializer<LocalDateTime>) (json, type, context) ->
                    LocalDateTime.parse(json.getAsString(), ISO_FORMATTER))
            .create();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Path dataDir;
    private final Path recordsDir;
    private final Path idIndexFile;
    private final Path templateIndexDir;

    private volatile boolean open;

    public JsonlRecordStore(Path dataDir) {
        this.dataDir = dataDir;
        this.recordsDir = dataDir.resolve("records");
        this.templateIndexDir = dataDir.resolve("template_index");
        this.idIndexFile = dataDir.resolve("id_index.txt");
    }

    public void open() {
        try {
            Files.createDirectories(recordsDir);
            Files.createDirectories(templateIndexDir);
            if (!Files.exists(idIndexFile)) {
                Files.createFile(idIndexFile);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize record store at " + dataDir, e);
        }
        open = true;
        logger.info("Record store opened at {}", dataDir.toAbsolutePath());
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            open = false;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Record store closed");
    }

    public boolean isOpen() {
        return open;
    }

    private void ensureOpen() {
        if (!open) {
            throw new IllegalStateException("Record store is not open");
        }
    }

    private Path getRecordsFileForDate(LocalDate date) {
        return recordsDir.resolve(date.toString() + ".jsonl");
    }

    private static LocalDate partitionDate(InspectionRecord record) {
        return record.getCreatedAt() != null ? record.getCreatedAt().toLocalDate() : LocalDate.now();
    }

    // ------------------------------------------------------------------ writes

    @Override
    public InspectionRecord insert(InspectionRecord record) {
        InspectionRecord toSave = record;
        if (toSave.getId() == null) {
            toSave = toSave.toBuilder().id(UUID.randomUUID().toString()).build();
        }
        if (toSave.getCreatedAt() == null) {
            toSave = toSave.toBuilder().createdAt(LocalDateTime.now()).build();
        }

        lock.writeLock().lock();
        try {
            ensureOpen();
            appendToFile(toSave);
            appendIndex(idIndexFile, toSave);
            if (toSave.getTemplateId() != null) {
                appendIndex(templateIndexDir.resolve(toSave.getTemplateId() + ".txt"), toSave);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return toSave;
    }

    private void appendToFile(InspectionRecord record) {
        Path targetFile = getRecordsFileForDate(partitionDate(record));
        try (BufferedWriter writer = Files.newBufferedWriter(targetFile,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(gson.toJson(record));
            writer.newLine();
        } catch (IOException e) {
            throw new RuntimeException("Failed to write to records file " + targetFile, e);
        }
    }

    private void appendIndex(Path indexFile, InspectionRecord record) {
        String indexEntry = record.getId() + "," + partitionDate(record) + "\n";
        try {
            Files.writeString(indexFile, indexEntry, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new RuntimeException("Failed to update index " + indexFile, e);
        }
    }

    /**
     * 更新记录（只重写对应日期的文件，记录保持原有位置）
     */
    @Override
    public void update(InspectionRecord record) {
        if (record.getId() == null) {
            throw new IllegalArgumentException("Record ID cannot be null");
        }

        lock.writeLock().lock();
        try {
            ensureOpen();
            Optional<LocalDate> date = findDateById(record.getId());
            if (date.isEmpty()) {
                throw new IllegalArgumentException("Record not found: " + record.getId());
            }
            Path targetFile = getRecordsFileForDate(date.get());
            List<String> lines = readLines(targetFile);

            List<String> rewritten = new ArrayList<>(lines.size() + 1);
            boolean found = false;
            for (String line : lines) {
                if (line.trim().isEmpty()) {
                    continue;
                }
                InspectionRecord existing = parse(line, targetFile);
                if (existing != null && record.getId().equals(existing.getId())) {
                    rewritten.add(gson.toJson(record));
                    found = true;
                } else {
                    rewritten.add(line);
                }
            }
            if (!found) {
                rewritten.add(gson.toJson(record));
            }
            replaceFile(targetFile, rewritten);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String id) {
        lock.writeLock().lock();
        try {
            ensureOpen();
            Optional<LocalDate> date = findDateById(id);
            if (date.isEmpty()) {
                return;
            }
            Path targetFile = getRecordsFileForDate(date.get());
            String templateId = null;

            if (Files.exists(targetFile)) {
                List<String> kept = new ArrayList<>();
                for (String line : readLines(targetFile)) {
                    if (line.trim().isEmpty()) {
                        continue;
                    }
                    InspectionRecord existing = parse(line, targetFile);
                    if (existing != null && id.equals(existing.getId())) {
                        templateId = existing.getTemplateId();
                        continue;
                    }
                    kept.add(line);
                }
                replaceFile(targetFile, kept);
            }

            removeFromIndex(idIndexFile, id);
            if (templateId != null) {
                removeFromIndex(templateIndexDir.resolve(templateId + ".txt"), id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void removeFromIndex(Path indexFile, String id) {
        if (!Files.exists(indexFile)) {
            return;
        }
        List<String> filtered = readLines(indexFile).stream()
                .filter(line -> !line.trim().isEmpty())
                .filter(line -> !line.startsWith(id + ","))
                .collect(Collectors.toList());
        replaceFile(indexFile, filtered);
    }

    /**
     * 先写临时文件再原子替换，写入失败时原文件保持不变
     */
    private void replaceFile(Path target, List<String> lines) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(tmp)) {
                for (String line : lines) {
                    writer.write(line);
                    writer.newLine();
                }
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to rewrite " + target, e);
        }
    }

    // ------------------------------------------------------------------ reads

    @Override
    public Optional<InspectionRecord> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            ensureOpen();
            Optional<LocalDate> date = findDateById(id);
            if (date.isEmpty()) {
                return Optional.empty();
            }
            return readFile(getRecordsFileForDate(date.get()), r -> id.equals(r.getId()))
                    .stream()
                    .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<MeasurementItem> getItemsForRecord(String recordId) {
        return findById(recordId)
                .map(InspectionRecord::getItems)
                .orElse(List.of());
    }

    @Override
    public List<InspectionRecord> getRecordsForTemplate(String templateId, DateRange range) {
        if (templateId == null) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            ensureOpen();
            Path indexFile = templateIndexDir.resolve(templateId + ".txt");
            if (!Files.exists(indexFile)) {
                return List.of();
            }

            // 日期 -> 记录 ID，日期升序
            SortedMap<LocalDate, Set<String>> idsByDate = new TreeMap<>();
            for (String[] parts : readIndex(indexFile)) {
                idsByDate.computeIfAbsent(LocalDate.parse(parts[1]), k -> new HashSet<>()).add(parts[0]);
            }

            List<InspectionRecord> results = new ArrayList<>();
            for (Map.Entry<LocalDate, Set<String>> entry : idsByDate.entrySet()) {
                if (!dateMayMatch(entry.getKey(), range)) {
                    continue;
                }
                Set<String> ids = entry.getValue();
                results.addAll(readFile(getRecordsFileForDate(entry.getKey()),
                        r -> ids.contains(r.getId()) && matchesRange(r, range)));
            }
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<InspectionRecord> findAll(DateRange range) {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<InspectionRecord> results = new ArrayList<>();
            for (Path file : listDateFiles(false)) {
                LocalDate date = dateOf(file);
                if (date != null && !dateMayMatch(date, range)) {
                    continue;
                }
                results.addAll(readFile(file, r -> matchesRange(r, range)));
            }
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<InspectionRecord> findRecent(int limit) {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<InspectionRecord> results = new ArrayList<>();
            for (Path file : listDateFiles(true)) {
                if (results.size() >= limit) {
                    break;
                }
                List<InspectionRecord> batch = new ArrayList<>(readFile(file, r -> true));
                // 文件末尾是最新的记录
                Collections.reverse(batch);
                int needed = limit - results.size();
                results.addAll(batch.subList(0, Math.min(needed, batch.size())));
            }
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            ensureOpen();
            long total = 0;
            for (Path file : listDateFiles(false)) {
                total += readLines(file).stream().filter(line -> !line.trim().isEmpty()).count();
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ------------------------------------------------------------------ helpers

    private Optional<LocalDate> findDateById(String id) {
        if (!Files.exists(idIndexFile)) {
            return Optional.empty();
        }
        return readIndex(idIndexFile).stream()
                .filter(parts -> id.equals(parts[0]))
                .map(parts -> LocalDate.parse(parts[1]))
                .findFirst();
    }

    private List<String[]> readIndex(Path indexFile) {
        return readLines(indexFile).stream()
                .filter(line -> !line.trim().isEmpty())
                .map(line -> line.split(","))
                .filter(parts -> parts.length == 2)
                .collect(Collectors.toList());
    }

    private List<Path> listDateFiles(boolean newestFirst) {
        if (!Files.exists(recordsDir)) {
            return List.of();
        }
        // 文件名本身就是日期，按名称排序即按日期排序
        Comparator<Path> order = newestFirst ? Comparator.reverseOrder() : Comparator.naturalOrder();
        try (Stream<Path> files = Files.list(recordsDir)) {
            return files
                    .filter(p -> p.toString().endsWith(".jsonl"))
                    .sorted(order)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuntimeException("Failed to list records directory " + recordsDir, e);
        }
    }

    private List<InspectionRecord> readFile(Path file, Predicate<InspectionRecord> filter) {
        if (!Files.exists(file)) {
            return List.of();
        }
        return readLines(file).stream()
                .filter(line -> !line.trim().isEmpty())
                .map(line -> parse(line, file))
                .filter(Objects::nonNull)
                .filter(filter)
                .collect(Collectors.toList());
    }

    private InspectionRecord parse(String line, Path file) {
        try {
            return gson.fromJson(line, InspectionRecord.class);
        } catch (Exception e) {
            logger.warn("Skipping corrupt line in {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private static List<String> readLines(Path file) {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + file, e);
        }
    }

    private static LocalDate dateOf(Path file) {
        String name = file.getFileName().toString();
        try {
            return LocalDate.parse(name.substring(0, name.length() - ".jsonl".length()));
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static boolean dateMayMatch(LocalDate date, DateRange range) {
        if (range == null || range.isUnbounded()) {
            return true;
        }
        return (range.getStart() == null || !date.isBefore(range.getStart()))
                && (range.getEnd() == null || !date.isAfter(range.getEnd()));
    }

    private static boolean matchesRange(InspectionRecord record, DateRange range) {
        return range == null || range.isUnbounded() || range.contains(record.getCreatedAt());
    }
}
