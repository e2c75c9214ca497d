package com.masterplan.geometry;

import com.masterplan.file.SourceAssetException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/** The raw bytes of an overlay document (SVG) together with a name for messages. */
public class VectorDocument {

    public final String name;
    public final byte[] content;

    public VectorDocument (String name, byte[] content) {
        this.name = name;
        this.content = content;
    }

    public static VectorDocument fromString (String name, String svg) {
        return new VectorDocument(name, svg.getBytes(StandardCharsets.UTF_8));
    }

    public static VectorDocument fromFile (File file) {
        try {
            return new VectorDocument(file.getName(), Files.readAllBytes(file.toPath()));
        } catch (IOException e) {
            throw new SourceAssetException("Could not read vector document " + file.getName(), e);
        }
    }

}
