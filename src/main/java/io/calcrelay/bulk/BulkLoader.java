package io.calcrelay.bulk;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.calcrelay.storage.ContentStore;
import io.calcrelay.storage.ImportBatch;
import io.calcrelay.storage.MetadataStore;
import io.calcrelay.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads an import file into the project:
 *
 * <pre>
 * {
 *   "objects":  {"&lt;label&gt;": {"content": "...", "encoding": "utf8|base64", "extension": "txt"} | {"path": "file"}},
 *   "clients":  [{"label", "client_url", "client_id", "client_secret", "token_uri",
 *                 "machine_name", "work_dir", "small_file_size_mb"}],
 *   "codes":    [{"label", "client_label", "script", "upload_paths"}],
 *   "calcjobs": [{"label", "uuid", "code_label", "parameters", "upload_paths", "download_globs"}]
 * }
 * </pre>
 *
 * Upload path values are {@code {"label": ...}} (an object of this file),
 * {@code {"key": ...}} (an object already stored) or null for a directory.
 * Objects are stored first; the rows then go in as one transaction.
 */
public final class BulkLoader {
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final int DEFAULT_SMALL_FILE_SIZE_MB = 5;

    private final ContentStore contentStore;
    private final MetadataStore metadataStore;

    public BulkLoader(ContentStore contentStore, MetadataStore metadataStore) {
        this.contentStore = contentStore;
        this.metadataStore = metadataStore;
    }

    public LoadResult load(Path file) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read import file " + file + ": " + e.getMessage(), e);
        }
        Path baseDir = file.toAbsolutePath().getParent();
        return load(root, baseDir);
    }

    public LoadResult load(JsonNode root, Path baseDir) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Expected an object at the top level");
        }
        JsonNode objectsNode = root.path("objects");
        if (!objectsNode.isMissingNode() && !objectsNode.isObject()) {
            throw new IllegalArgumentException("Expected an object for key 'objects'");
        }
        for (String key : List.of("clients", "codes", "calcjobs")) {
            JsonNode node = root.path(key);
            if (!node.isMissingNode() && !node.isArray()) {
                throw new IllegalArgumentException("Expected a list for key '" + key + "'");
            }
        }

        Map<String, String> objectKeys = storeObjects(objectsNode, baseDir);

        List<ImportBatch.NewClient> clients = new ArrayList<>();
        int idx = 0;
        for (JsonNode item : root.path("clients")) {
            String name = "clients[" + idx++ + "]";
            requireObject(item, name);
            clients.add(new ImportBatch.NewClient(
                    requireText(item, "label", name),
                    requireText(item, "client_url", name),
                    optionalText(item, "client_id"),
                    optionalText(item, "client_secret"),
                    optionalText(item, "token_uri"),
                    requireText(item, "machine_name", name),
                    requireText(item, "work_dir", name),
                    item.path("small_file_size_mb").asInt(DEFAULT_SMALL_FILE_SIZE_MB)
            ));
        }

        List<ImportBatch.NewCode> codes = new ArrayList<>();
        idx = 0;
        for (JsonNode item : root.path("codes")) {
            String name = "codes[" + idx++ + "]";
            requireObject(item, name);
            codes.add(new ImportBatch.NewCode(
                    requireText(item, "label", name),
                    requireText(item, "client_label", name),
                    requireText(item, "script", name),
                    convertUploadPaths(item.path("upload_paths"), objectKeys, name)
            ));
        }

        List<ImportBatch.NewCalcJob> calcjobs = new ArrayList<>();
        idx = 0;
        for (JsonNode item : root.path("calcjobs")) {
            String name = "calcjobs[" + idx++ + "]";
            requireObject(item, name);
            JsonNode params = item.path("parameters");
            if (!params.isMissingNode() && !params.isNull() && !params.isObject()) {
                throw new IllegalArgumentException("Expected an object for " + name + "['parameters']");
            }
            calcjobs.add(new ImportBatch.NewCalcJob(
                    requireText(item, "label", name),
                    optionalText(item, "uuid"),
                    requireText(item, "code_label", name),
                    params.isObject() ? Jsons.mapper().convertValue(params, OBJECT_MAP) : Map.of(),
                    convertUploadPaths(item.path("upload_paths"), objectKeys, name),
                    textList(item.path("download_globs"), name + "['download_globs']")
            ));
        }

        ImportBatch.Result rows = metadataStore.importBatch(new ImportBatch(clients, codes, calcjobs));
        return new LoadResult(objectKeys, rows.clientPks(), rows.codePks(), rows.calcjobPks());
    }

    private Map<String, String> storeObjects(JsonNode objectsNode, Path baseDir) {
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = objectsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String label = entry.getKey();
            JsonNode spec = entry.getValue();
            if (!spec.isObject()) {
                throw new IllegalArgumentException("Expected an object for object '" + label + "'");
            }
            String extension = spec.path("extension").asText("txt");
            if (spec.has("content")) {
                if (!spec.get("content").isTextual()) {
                    throw new IllegalArgumentException("Expected a string for object '" + label + "'");
                }
                out.put(label, contentStore.put(decode(spec.get("content").asText(), spec.path("encoding").asText("utf8"), label), extension));
            } else if (spec.has("path")) {
                Path source = baseDir == null ? Path.of(spec.get("path").asText()) : baseDir.resolve(spec.get("path").asText());
                String ext = spec.has("extension") ? extension : extensionOf(source);
                try (InputStream in = Files.newInputStream(source)) {
                    out.put(label, contentStore.putStream(in, ext));
                } catch (IOException e) {
                    throw new IllegalArgumentException("Cannot read object '" + label + "' from " + source, e);
                }
            } else {
                throw new IllegalArgumentException("Expected either 'content' or 'path' for object '" + label + "'");
            }
        }
        return out;
    }

    private Map<String, String> convertUploadPaths(JsonNode node, Map<String, String> objectKeys, String prefix) {
        Map<String, String> out = new LinkedHashMap<>();
        if (node.isMissingNode() || node.isNull()) {
            return out;
        }
        String name = prefix + "['upload_paths']";
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected an object for " + name);
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String path = entry.getKey();
            JsonNode value = entry.getValue();
            if (value.isNull()) {
                out.put(path, null);
                continue;
            }
            if (!value.isObject()) {
                throw new IllegalArgumentException("Expected an object or null for " + name + "['" + path + "']");
            }
            String key;
            if (value.has("label")) {
                String label = value.get("label").asText();
                key = objectKeys.get(label);
                if (key == null) {
                    throw new IllegalArgumentException(name + "['" + path + "']['label'] = '" + label + "' not found");
                }
            } else if (value.has("key")) {
                key = value.get("key").asText();
            } else {
                throw new IllegalArgumentException("Expected either 'label' or 'key' for " + name + "['" + path + "']");
            }
            out.put(path, key);
        }
        return out;
    }

    private static byte[] decode(String content, String encoding, String label) {
        switch (encoding.toLowerCase(Locale.ROOT)) {
            case "utf8":
            case "utf-8":
                return content.getBytes(StandardCharsets.UTF_8);
            case "base64":
                try {
                    return Base64.getDecoder().decode(content);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid base64 content for object '" + label + "'", e);
                }
            default:
                throw new IllegalArgumentException("Unsupported encoding '" + encoding + "' for object '" + label + "'");
        }
    }

    private static void requireObject(JsonNode item, String name) {
        if (!item.isObject()) {
            throw new IllegalArgumentException("Expected an object for item '" + name + "'");
        }
    }

    private static String requireText(JsonNode item, String field, String name) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException(name + " has no '" + field + "' key");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode item, String field) {
        JsonNode value = item.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> textList(JsonNode node, String name) {
        List<String> out = new ArrayList<>();
        if (node.isMissingNode() || node.isNull()) {
            return out;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("Expected a list for " + name);
        }
        for (JsonNode value : node) {
            out.add(value.asText());
        }
        return out;
    }

    private static String extensionOf(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1);
    }

    public record LoadResult(
            Map<String, String> objects,
            List<Long> clients,
            List<Long> codes,
            List<Long> calcjobs
    ) {
    }
}
