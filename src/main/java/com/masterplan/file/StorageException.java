package com.masterplan.file;

/**
 * Thrown when files cannot be written to, copied within, or read back from storage, including attempts to write a
 * key that already exists. Storage problems are always fatal to the job that encounters them.
 */
public class StorageException extends RuntimeException {

    public StorageException (String message) {
        super(message);
    }

    public StorageException (String message, Throwable cause) {
        super(message, cause);
    }

}
