package io.calcrelay.remote;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test gateway holding a fake remote file tree and scheduler in memory.
 *
 * <p>A submitted job reports RUNNING for {@code pollsUntilDone} status
 * requests, then ends with {@code finalStatus}; on completion the configured
 * outputs appear in the job script's folder.
 */
public final class InMemoryGateway implements RemoteGateway {
    private final Map<String, byte[]> files = new TreeMap<>();
    private final Set<String> dirs = new HashSet<>();
    private final Map<String, Integer> uploadCounts = new HashMap<>();
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final List<Integer> pollBatchSizes = new ArrayList<>();
    private final List<Long> pollTimesNanos = new ArrayList<>();
    private final Deque<RemoteCallException> uploadFailures = new ArrayDeque<>();
    private final Deque<RemoteCallException> submitFailures = new ArrayDeque<>();
    private final AtomicInteger submits = new AtomicInteger();

    private int pollsUntilDone = 1;
    private RemoteStatus finalStatus = RemoteStatus.COMPLETED;
    private Map<String, byte[]> outputs = Map.of();

    public InMemoryGateway() {
        dirs.add("/");
    }

    public synchronized InMemoryGateway completeAfterPolls(int polls) {
        this.pollsUntilDone = polls;
        return this;
    }

    public synchronized InMemoryGateway endWith(RemoteStatus status) {
        this.finalStatus = status;
        return this;
    }

    /**
     * Files (relative to the job folder) written when a job completes.
     */
    public synchronized InMemoryGateway producing(Map<String, byte[]> outputsOnCompletion) {
        this.outputs = new LinkedHashMap<>(outputsOnCompletion);
        return this;
    }

    public synchronized InMemoryGateway failNextUpload(RemoteCallException failure) {
        uploadFailures.add(failure);
        return this;
    }

    public synchronized InMemoryGateway failNextSubmit(RemoteCallException failure) {
        submitFailures.add(failure);
        return this;
    }

    public int submitCount() {
        return submits.get();
    }

    public synchronized int uploadCount(String path) {
        return uploadCounts.getOrDefault(path, 0);
    }

    public synchronized List<Integer> pollBatchSizes() {
        return new ArrayList<>(pollBatchSizes);
    }

    /**
     * Milliseconds between consecutive status requests.
     */
    public synchronized List<Long> pollGapsMs() {
        List<Long> gaps = new ArrayList<>();
        for (int i = 1; i < pollTimesNanos.size(); i++) {
            gaps.add((pollTimesNanos.get(i) - pollTimesNanos.get(i - 1)) / 1_000_000L);
        }
        return gaps;
    }

    public synchronized byte[] file(String path) {
        return files.get(path);
    }

    public synchronized boolean isDirectory(String path) {
        return dirs.contains(path);
    }

    @Override
    public synchronized void mkdirs(String dir) {
        if (files.containsKey(dir)) {
            throw new RemoteCallException(RemoteCallException.Kind.FATAL, "not a directory: " + dir);
        }
        String current = dir;
        while (current != null && !current.isEmpty()) {
            dirs.add(current);
            current = "/".equals(current) ? null : RemotePaths.parent(current);
        }
    }

    @Override
    public synchronized void upload(UploadSource source, String path) {
        RemoteCallException failure = uploadFailures.poll();
        if (failure != null) {
            throw failure;
        }
        if (!dirs.contains(RemotePaths.parent(path))) {
            throw new RemoteCallException(RemoteCallException.Kind.NOT_FOUND, "target folder missing: " + path);
        }
        try {
            files.put(path, source.readAllBytes());
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.FATAL, "unreadable source", e);
        }
        uploadCounts.merge(path, 1, Integer::sum);
    }

    @Override
    public synchronized String submit(String scriptPath) {
        RemoteCallException failure = submitFailures.poll();
        if (failure != null) {
            throw failure;
        }
        if (!files.containsKey(scriptPath)) {
            throw new RemoteCallException(RemoteCallException.Kind.NOT_FOUND, "job script missing: " + scriptPath);
        }
        String jobId = "job-" + submits.incrementAndGet();
        jobs.put(jobId, new Job(RemotePaths.parent(scriptPath)));
        return jobId;
    }

    @Override
    public synchronized Map<String, RemoteStatus> poll(Collection<String> jobIds) {
        pollBatchSizes.add(jobIds.size());
        pollTimesNanos.add(System.nanoTime());
        Map<String, RemoteStatus> out = new LinkedHashMap<>();
        for (String jobId : jobIds) {
            Job job = jobs.get(jobId);
            if (job == null) {
                continue;
            }
            if (job.status == RemoteStatus.RUNNING && ++job.polls >= pollsUntilDone) {
                job.status = finalStatus;
                if (finalStatus == RemoteStatus.COMPLETED) {
                    for (Map.Entry<String, byte[]> output : outputs.entrySet()) {
                        String target = RemotePaths.join(job.folder, output.getKey());
                        mkdirs(RemotePaths.parent(target));
                        files.put(target, output.getValue());
                    }
                }
            }
            out.put(jobId, job.status);
        }
        return out;
    }

    @Override
    public synchronized List<RemoteEntry> list(String dir, List<String> globs) {
        if (!dirs.contains(dir)) {
            throw new RemoteCallException(RemoteCallException.Kind.NOT_FOUND, "folder missing: " + dir);
        }
        var matchers = RemotePaths.compile(globs);
        String prefix = dir.endsWith("/") ? dir : dir + "/";
        List<RemoteEntry> out = new ArrayList<>();
        for (String d : dirs) {
            if (d.startsWith(prefix) && RemotePaths.matchesAny(matchers, d.substring(prefix.length()))) {
                out.add(new RemoteEntry(d.substring(prefix.length()), true, 0L));
            }
        }
        for (Map.Entry<String, byte[]> f : files.entrySet()) {
            String relative = f.getKey().startsWith(prefix) ? f.getKey().substring(prefix.length()) : null;
            if (relative != null && RemotePaths.matchesAny(matchers, relative)) {
                out.add(new RemoteEntry(relative, false, f.getValue().length));
            }
        }
        out.sort((a, b) -> a.path().compareTo(b.path()));
        return out;
    }

    @Override
    public synchronized byte[] download(String path) {
        byte[] content = files.get(path);
        if (content == null) {
            throw new RemoteCallException(RemoteCallException.Kind.NOT_FOUND, "file missing: " + path);
        }
        return content.clone();
    }

    @Override
    public void close() {
    }

    private static final class Job {
        private final String folder;
        private RemoteStatus status = RemoteStatus.RUNNING;
        private int polls;

        private Job(String folder) {
            this.folder = folder;
        }
    }
}
