package org.arcanabar.exception;

import java.nio.file.Path;

/**
 * Файл счётчиков есть, но прочитать его нельзя. Стартовать с пустым состоянием нельзя: потеряем пользователей.
 */
public class StorageCorruptionException extends RuntimeException {

    private final Path file;

    public StorageCorruptionException(Path file, String message, Throwable cause) {
        super("Ledger file " + file + " is corrupt: " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
