package org.arcanabar.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.arcanabar.exception.LedgerWriteException;
import org.arcanabar.exception.StorageCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Файл со счётчиками пользователей. Один JSON-документ:
 * <pre>
 * {"version":1,"users":{"42":{"basicCount":1,"premiumCount":0,"createdAt":"...","updatedAt":"..."}}}
 * </pre>
 * Запись: весь снимок во временный файл рядом, fsync, затем атомарный rename поверх основного файла.
 * Основной файл либо старый целиком, либо новый целиком.
 * <p>
 * Класс не синхронизирован: параллельные {@link #write} сериализует вызывающий.
 */
public class LedgerFileStore {

    private static final Logger log = LoggerFactory.getLogger(LedgerFileStore.class);

    static final int FORMAT_VERSION = 1;
    static final String TEMP_SUFFIX = ".tmp";

    private static final String F_VERSION = "version";
    private static final String F_USERS = "users";
    private static final String F_BASIC = "basicCount";
    private static final String F_PREMIUM = "premiumCount";
    private static final String F_CREATED = "createdAt";
    private static final String F_UPDATED = "updatedAt";
    private static final Set<String> ENTRY_FIELDS = Set.of(F_BASIC, F_PREMIUM, F_CREATED, F_UPDATED);

    private final Path file;
    private final ObjectMapper om;

    public LedgerFileStore(Path file, ObjectMapper om) {
        this.file = file.toAbsolutePath();
        this.om = om;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Читает основной файл. Нет файла: пустой снимок. Файл битый: {@link StorageCorruptionException}.
     */
    public LedgerSnapshot load() {
        removeStaleTempFiles();

        if (!Files.exists(file)) {
            log.info("Ledger file {} not found, starting with an empty ledger", file);
            return LedgerSnapshot.empty();
        }

        JsonNode root;
        try {
            root = om.readTree(file.toFile());
        } catch (IOException e) {
            throw new StorageCorruptionException(file, "unreadable JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new StorageCorruptionException(file, "top-level value is not an object", null);
        }

        ObjectNode top = ((ObjectNode) root).deepCopy();
        JsonNode version = top.remove(F_VERSION);
        // без поля version: файл первой версии
        if (version != null && (!version.isIntegralNumber() || !version.canConvertToInt()
                || version.asInt() != FORMAT_VERSION)) {
            throw new StorageCorruptionException(file, "unsupported format version " + version, null);
        }

        JsonNode usersNode = top.remove(F_USERS);
        Map<String, LedgerEntry> users = new LinkedHashMap<>();
        if (usersNode != null && !usersNode.isNull()) {
            if (!usersNode.isObject()) {
                throw new StorageCorruptionException(file, "'users' is not an object", null);
            }
            Iterator<Map.Entry<String, JsonNode>> it = usersNode.fields();
            while (it.hasNext()) {
                var e = it.next();
                users.put(e.getKey(), readEntry(e.getKey(), e.getValue()));
            }
        }

        log.info("Ledger loaded from {}: {} user(s)", file, users.size());
        return new LedgerSnapshot(users, top);
    }

    /**
     * Атомарно заменяет основной файл снимком. Любая ошибка ввода-вывода пробрасывается как
     * {@link LedgerWriteException}, основной файл при этом остаётся прежним.
     */
    public void write(LedgerSnapshot snapshot) {
        Path dir = file.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName() + ".", TEMP_SUFFIX);

            byte[] bytes = om.writerWithDefaultPrettyPrinter().writeValueAsBytes(toJson(snapshot));
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }

            moveIntoPlace(tmp, file);
            tmp = null;
            log.debug("Ledger persisted: {} user(s), {} bytes", snapshot.users().size(), bytes.length);
        } catch (IOException e) {
            log.error("Ledger write to {} failed: {}", file, e.getMessage());
            throw new LedgerWriteException(file, e);
        } finally {
            if (tmp != null) {
                deleteTemp(tmp);
            }
        }
    }

    /**
     * Последний шаг записи. Всё, что было до него, основной файл не трогает.
     */
    protected void moveIntoPlace(Path tmp, Path target) throws IOException {
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    ObjectNode toJson(LedgerSnapshot snapshot) {
        ObjectNode root = snapshot.extra().deepCopy();
        root.put(F_VERSION, FORMAT_VERSION);
        ObjectNode users = root.putObject(F_USERS);
        snapshot.users().forEach((id, entry) -> {
            ObjectNode node = entry.extra().deepCopy();
            node.put(F_BASIC, entry.basicCount());
            node.put(F_PREMIUM, entry.premiumCount());
            putInstant(node, F_CREATED, entry.createdAt());
            putInstant(node, F_UPDATED, entry.updatedAt());
            users.set(id, node);
        });
        return root;
    }

    private LedgerEntry readEntry(String userId, JsonNode node) {
        if (!node.isObject()) {
            throw new StorageCorruptionException(file, "entry for user " + userId + " is not an object", null);
        }
        ObjectNode extra = ((ObjectNode) node).deepCopy();
        extra.remove(ENTRY_FIELDS);
        return new LedgerEntry(
                readCount(userId, node, F_BASIC),
                readCount(userId, node, F_PREMIUM),
                readInstant(userId, node, F_CREATED),
                readInstant(userId, node, F_UPDATED),
                extra
        );
    }

    private int readCount(String userId, JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return 0;
        if (!v.isIntegralNumber() || !v.canConvertToInt() || v.asInt() < 0) {
            throw new StorageCorruptionException(file, "bad " + field + " for user " + userId + ": " + v, null);
        }
        return v.asInt();
    }

    private Instant readInstant(String userId, JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isTextual()) {
            throw new StorageCorruptionException(file, "bad " + field + " for user " + userId + ": " + v, null);
        }
        try {
            return Instant.parse(v.asText());
        } catch (DateTimeParseException e) {
            throw new StorageCorruptionException(file, "bad " + field + " for user " + userId + ": " + v, e);
        }
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value.toString());
        }
    }

    // остатки записи, прерванной падением процесса до rename
    private void removeStaleTempFiles() {
        Path dir = file.getParent();
        if (!Files.isDirectory(dir)) return;
        String prefix = file.getFileName() + ".";
        DirectoryStream.Filter<Path> leftover = p -> {
            String name = p.getFileName().toString();
            return name.startsWith(prefix) && name.endsWith(TEMP_SUFFIX);
        };
        try (DirectoryStream<Path> stale = Files.newDirectoryStream(dir, leftover)) {
            for (Path p : stale) {
                log.warn("Removing leftover ledger temp file {}", p);
                deleteTemp(p);
            }
        } catch (IOException e) {
            log.warn("Could not scan {} for leftover ledger temp files: {}", dir, e.getMessage());
        }
    }

    private static void deleteTemp(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete ledger temp file {}: {}", tmp, e.getMessage());
        }
    }
}
