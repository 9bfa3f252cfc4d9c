package io.calcrelay.remote;

import io.calcrelay.storage.ContentStore;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Bytes to send to the remote, either held in memory or read from the
 * content store on demand.
 */
public final class UploadSource {
    private final byte[] bytes;
    private final ContentStore store;
    private final String key;
    private final long size;

    private UploadSource(byte[] bytes, ContentStore store, String key, long size) {
        this.bytes = bytes;
        this.store = store;
        this.key = key;
        this.size = size;
    }

    public static UploadSource ofBytes(byte[] bytes) {
        return new UploadSource(bytes.clone(), null, null, bytes.length);
    }

    public static UploadSource ofObject(ContentStore store, String key) {
        return new UploadSource(null, store, key, store.size(key));
    }

    public long size() {
        return size;
    }

    public InputStream openStream() {
        if (bytes != null) {
            return new ByteArrayInputStream(bytes);
        }
        return store.open(key);
    }

    public byte[] readAllBytes() throws IOException {
        if (bytes != null) {
            return bytes.clone();
        }
        try (InputStream in = store.open(key)) {
            return in.readAllBytes();
        }
    }

    @Override
    public String toString() {
        return key != null ? "object:" + key : "bytes[" + size + "]";
    }
}
