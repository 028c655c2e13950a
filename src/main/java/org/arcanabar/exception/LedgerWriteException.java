package org.arcanabar.exception;

import java.nio.file.Path;

public class LedgerWriteException extends RuntimeException {

    private final Path file;

    public LedgerWriteException(Path file, Throwable cause) {
        super("Failed to persist ledger to " + file + ": " + cause.getMessage(), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
