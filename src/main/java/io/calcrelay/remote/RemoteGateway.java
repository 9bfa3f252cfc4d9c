package io.calcrelay.remote;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * File transfer and batch-scheduler operations on one compute resource.
 * Paths are absolute, '/'-separated paths on the remote machine. Every
 * method reports failure through {@link RemoteCallException}.
 */
public interface RemoteGateway extends AutoCloseable {
    /**
     * Creates the directory and any missing parents. Existing directories are fine.
     */
    void mkdirs(String dir);

    /**
     * Writes the file at {@code path}, replacing any previous content.
     */
    void upload(UploadSource source, String path);

    /**
     * Submits an existing remote job script and returns the scheduler job id.
     */
    String submit(String scriptPath);

    /**
     * Status of each requested job id. Ids the scheduler does not report yet are absent.
     */
    Map<String, RemoteStatus> poll(Collection<String> jobIds);

    /**
     * Recursive listing of {@code dir}; only entries matching one of
     * {@code globs} are returned, or all entries when {@code globs} is empty.
     */
    List<RemoteEntry> list(String dir, List<String> globs);

    byte[] download(String path);

    @Override
    void close();
}
