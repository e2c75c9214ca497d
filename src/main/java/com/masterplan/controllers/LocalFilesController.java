package com.masterplan.controllers;

import com.masterplan.ReleaseServerException;
import com.masterplan.file.FileCategory;
import com.masterplan.file.FileStorageKey;
import com.masterplan.file.LocalFileStorage;
import com.masterplan.tiles.TileFormat;
import spark.Request;
import spark.Response;
import spark.Service;

import java.io.File;
import java.io.FileInputStream;
import java.util.Locale;

/**
 * Serves stored files when running with local storage, so the viewer can fetch release manifests and tiles from the
 * URLs LocalFileStorage hands out. Only published releases are exposed, never draft uploads.
 */
public class LocalFilesController implements HttpController {

    private final LocalFileStorage fileStorage;

    public LocalFilesController (LocalFileStorage fileStorage) {
        this.fileStorage = fileStorage;
    }

    private Object getFile (Request req, Response res) throws Exception {
        FileCategory category = FileCategory.valueOf(req.params("category").toUpperCase(Locale.ROOT));
        if (category != FileCategory.RELEASES) {
            throw ReleaseServerException.notFound("Only published releases are served.");
        }
        String path = req.splat()[0];
        FileStorageKey key = new FileStorageKey(req.params("project"), category, path);
        File file = fileStorage.getFile(key);
        if (!file.isFile()) {
            throw ReleaseServerException.notFound("No such file: " + key.fullPath());
        }
        res.type(mimeType(path));
        // Releases are immutable, so their files can be cached indefinitely.
        res.header("Cache-Control", "public, max-age=31536000, immutable");
        // Spark streams an InputStream return value to the client and closes it.
        return new FileInputStream(file);
    }

    private static String mimeType (String path) {
        String extension = path.substring(path.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        switch (extension) {
            case "json":
                return "application/json";
            case "dzi":
                return "application/xml";
            default:
                try {
                    return TileFormat.forName(extension).mimeType;
                } catch (IllegalArgumentException e) {
                    return "application/octet-stream";
                }
        }
    }

    @Override
    public void registerEndpoints (Service sparkService) {
        sparkService.get("/files/:project/:category/*", this::getFile);
    }

}
