package io.calcrelay.storage;

import io.calcrelay.config.CalcRelayConfig;
import io.calcrelay.error.NotFoundException;
import io.calcrelay.util.Hashing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Append-only blob store keyed by the SHA-256 of the content.
 *
 * <p>Blobs live at {@code objects/<first two hex chars>/<digest>}. A blob is
 * written to a temporary file in its final directory, synced, and moved into
 * place, so readers never observe a partial object. Writing identical bytes a
 * second time is a no-op. The extension tag passed to {@link #put} is kept in a
 * {@code <digest>.ext} sidecar.
 */
public final class ContentStore {
    private static final Pattern KEY_PATTERN = Pattern.compile("[0-9a-f]{64}");
    private static final String EXT_SUFFIX = ".ext";
    private static final int COPY_BUFSIZE = 64 * 1024;

    private final Path root;

    public ContentStore(CalcRelayConfig config) {
        this(config.objectsDir());
    }

    public ContentStore(Path root) {
        this.root = root;
    }

    public void init() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize object store: " + root, e);
        }
    }

    public String put(byte[] content, String extension) {
        try {
            return putStream(new ByteArrayInputStream(content), extension);
        } catch (IOException e) {
            throw new RuntimeException("Failed to store object", e);
        }
    }

    public String putStream(InputStream in, String extension) throws IOException {
        Files.createDirectories(root);
        MessageDigest digest = Hashing.newSha256();
        Path temp = Files.createTempFile(root, "incoming-", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE);
                 OutputStream out = Channels.newOutputStream(channel)) {
                byte[] buffer = new byte[COPY_BUFSIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    digest.update(buffer, 0, read);
                    out.write(buffer, 0, read);
                }
                out.flush();
                channel.force(true);
            }
            String key = Hashing.hex(digest.digest());
            Path target = blobPath(key);
            if (Files.exists(target)) {
                return key;
            }
            Files.createDirectories(target.getParent());
            writeExtension(key, extension);
            moveIntoPlace(temp, target);
            return key;
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public byte[] get(String key) {
        Path path = requireBlob(key);
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read object: " + key, e);
        }
    }

    public InputStream open(String key) {
        Path path = requireBlob(key);
        try {
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw new RuntimeException("Failed to open object: " + key, e);
        }
    }

    public long size(String key) {
        Path path = requireBlob(key);
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new RuntimeException("Failed to stat object: " + key, e);
        }
    }

    public String extension(String key) {
        Path path = requireBlob(key);
        Path ext = path.resolveSibling(key + EXT_SUFFIX);
        try {
            return Files.exists(ext) ? Files.readString(ext, StandardCharsets.UTF_8).trim() : "";
        } catch (IOException e) {
            throw new RuntimeException("Failed to read object extension: " + key, e);
        }
    }

    public boolean exists(String key) {
        return isValidKey(key) && Files.isRegularFile(blobPath(key));
    }

    public List<String> keys() {
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return out;
        }
        try (DirectoryStream<Path> shards = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path shard : shards) {
                try (DirectoryStream<Path> blobs = Files.newDirectoryStream(shard)) {
                    for (Path blob : blobs) {
                        String name = blob.getFileName().toString();
                        if (isValidKey(name)) {
                            out.add(name);
                        }
                    }
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list objects", e);
        }
        out.sort(String::compareTo);
        return out;
    }

    public int count() {
        return keys().size();
    }

    public static boolean isValidKey(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    private Path requireBlob(String key) {
        if (!isValidKey(key)) {
            throw new NotFoundException("Object not found: " + key);
        }
        Path path = blobPath(key);
        if (!Files.isRegularFile(path)) {
            throw new NotFoundException("Object not found: " + key);
        }
        return path;
    }

    private Path blobPath(String key) {
        return root.resolve(key.substring(0, 2)).resolve(key);
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (FileAlreadyExistsException e) {
            // a concurrent writer stored the same content first
        } catch (AtomicMoveNotSupportedException e) {
            try {
                Files.move(temp, target);
            } catch (FileAlreadyExistsException ignored) {
                // same as above
            }
        }
    }

    private void writeExtension(String key, String extension) throws IOException {
        if (extension == null || extension.isBlank()) {
            return;
        }
        Path ext = blobPath(key).resolveSibling(key + EXT_SUFFIX);
        if (!Files.exists(ext)) {
            Files.writeString(ext, extension.trim(), StandardCharsets.UTF_8);
        }
    }
}
