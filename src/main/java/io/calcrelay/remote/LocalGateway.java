package io.calcrelay.remote;

import io.calcrelay.model.ClientRow;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Gateway for clients whose URL is {@code local:}. The work directory is a
 * path on this machine and a submitted script runs with {@code sh} in its
 * folder. A small shell wrapper around the script writes its exit code to
 * {@code <work_dir>/.calcrelay-jobs/<jobId>.exit} once it ends, so any gateway
 * instance on this machine can {@link #poll} the job, including one created
 * after the submitting process went away.
 */
public final class LocalGateway implements RemoteGateway {
    public static final String SCHEME = "local:";
    static final String JOBS_DIR = ".calcrelay-jobs";
    // $1 is the script, $2 the exit file; the status is renamed into place.
    private static final String WRAPPER =
            "trap '' HUP; sh \"$1\"; code=$?; printf '%s\\n' \"$code\" > \"$2.tmp\" && mv -f \"$2.tmp\" \"$2\"";

    private final Path jobsDir;

    public LocalGateway(ClientRow client) {
        this.jobsDir = Paths.get(client.workDir()).resolve(JOBS_DIR);
    }

    public static boolean handles(String clientUrl) {
        return clientUrl != null && clientUrl.startsWith(SCHEME);
    }

    @Override
    public void mkdirs(String dir) {
        try {
            Files.createDirectories(Paths.get(dir));
        } catch (FileAlreadyExistsException e) {
            throw new RemoteCallException(RemoteCallException.Kind.FATAL, "not a directory: " + dir, e);
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.TRANSIENT, "mkdir failed: " + dir, e);
        }
    }

    @Override
    public void upload(UploadSource source, String path) {
        Path target = Paths.get(path);
        Path parent = target.getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            throw new RemoteCallException(RemoteCallException.Kind.NOT_FOUND, "target folder missing: " + parent);
        }
        try (InputStream in = source.openStream()) {
            Path temp = Files.createTempFile(parent, ".upload-", ".tmp");
            try {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.TRANSIENT, "upload failed: " + path, e);
        }
    }

    @Override
    public String submit(String scriptPath) {
        Path script = Paths.get(scriptPath);
        if (!Files.isRegularFile(script)) {
            throw new RemoteCallException(RemoteCallException.Kind.NOT_FOUND, "job script missing: " + scriptPath);
        }
        String jobId = "local-" + UUID.randomUUID();
        try {
            Files.createDirectories(jobsDir);
            Path exitFile = jobsDir.resolve(jobId + ".exit").toAbsolutePath();
            ProcessBuilder pb = new ProcessBuilder("sh", "-c", WRAPPER, "calcrelay-job",
                    script.getFileName().toString(), exitFile.toString());
            pb.directory(script.getParent().toFile());
            pb.redirectErrorStream(true);
            pb.redirectOutput(jobsDir.resolve(jobId + ".out").toFile());
            pb.start();
            return jobId;
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.FATAL, "script spawn failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, RemoteStatus> poll(Collection<String> jobIds) {
        Map<String, RemoteStatus> out = new LinkedHashMap<>();
        for (String jobId : jobIds) {
            Path exitFile = jobsDir.resolve(jobId + ".exit");
            if (!Files.isRegularFile(exitFile)) {
                out.put(jobId, RemoteStatus.RUNNING);
                continue;
            }
            try {
                int code = Integer.parseInt(Files.readString(exitFile, StandardCharsets.UTF_8).trim());
                out.put(jobId, code == 0 ? RemoteStatus.COMPLETED : RemoteStatus.FAILED);
            } catch (IOException | NumberFormatException e) {
                throw new RemoteCallException(RemoteCallException.Kind.TRANSIENT, "cannot read exit status of " + jobId, e);
            }
        }
        return out;
    }

    @Override
    public List<RemoteEntry> list(String dir, List<String> globs) {
        Path root = Paths.get(dir);
        if (!Files.isDirectory(root)) {
            throw new RemoteCallException(RemoteCallException.Kind.NOT_FOUND, "folder missing: " + dir);
        }
        List<PathMatcher> matchers = RemotePaths.compile(globs);
        List<RemoteEntry> out = new ArrayList<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(root);
        try {
            while (!pending.isEmpty()) {
                try (DirectoryStream<Path> children = Files.newDirectoryStream(pending.pop())) {
                    for (Path child : children) {
                        String relative = root.relativize(child).toString().replace('\\', '/');
                        boolean directory = Files.isDirectory(child);
                        if (directory) {
                            pending.push(child);
                        }
                        if (RemotePaths.matchesAny(matchers, relative)) {
                            out.add(new RemoteEntry(relative, directory, directory ? 0L : Files.size(child)));
                        }
                    }
                }
            }
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.TRANSIENT, "listing failed: " + dir, e);
        }
        out.sort((a, b) -> a.path().compareTo(b.path()));
        return out;
    }

    @Override
    public byte[] download(String path) {
        try {
            return Files.readAllBytes(Paths.get(path));
        } catch (NoSuchFileException e) {
            throw new RemoteCallException(RemoteCallException.Kind.NOT_FOUND, "file missing: " + path, e);
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.TRANSIENT, "download failed: " + path, e);
        }
    }

    /**
     * Jobs still running keep running; their wrapper records the exit code when they end.
     */
    @Override
    public void close() {
    }
}
