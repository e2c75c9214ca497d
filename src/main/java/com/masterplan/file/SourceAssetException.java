package com.masterplan.file;

/**
 * An input asset supplied by the editing side (base raster image or vector overlay document) is missing,
 * unreadable or corrupt.
 */
public class SourceAssetException extends RuntimeException {

    public SourceAssetException (String message) {
        super(message);
    }

    public SourceAssetException (String message, Throwable cause) {
        super(message, cause);
    }

}
