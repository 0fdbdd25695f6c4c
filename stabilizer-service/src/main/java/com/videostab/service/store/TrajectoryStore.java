package com.videostab.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.io.NpyArrays;
import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.Trajectory;
import com.videostab.core.smoothing.SmoothingAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * File-system store for phase artifacts. Each run owns {@code <baseDir>/<runId>/} holding the
 * {@code .npy} arrays shared with external tools and a {@code manifest.json}.
 */
public class TrajectoryStore {

    private static final Logger log = LoggerFactory.getLogger(TrajectoryStore.class);

    private static final String STAGE = "store";
    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    public static final String TRAJECTORY_FILE = "trajectory_X_act.npy";
    public static final String VECTORS_FILE    = "vectors_V_act.npy";
    public static final String MANIFEST_FILE   = "manifest.json";

    private static final String SMOOTH_GLOB = "X_smooth_*.npy";

    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final Map<String, ReentrantLock> runLocks = new ConcurrentHashMap<>();

    public TrajectoryStore(Path baseDir, ObjectMapper objectMapper) {
        this.baseDir = baseDir;
        this.objectMapper = objectMapper;
    }

    public static String smoothFileName(SmoothingAlgorithm algorithm) {
        return "X_smooth_" + algorithm.tag() + ".npy";
    }

    public Path runDir(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches() || runId.contains("..")) {
            throw new StabilizationException(FailureKind.INVALID_PARAMETER, STAGE,
                "invalid runId '" + runId + "'");
        }
        return baseDir.resolve(runId);
    }

    public boolean exists(String runId) {
        return Files.isDirectory(runDir(runId));
    }

    /**
     * Runs {@code work} while holding the run's lock. Phases that read and rewrite a run's
     * manifest go through here so concurrent requests on one run apply one after another.
     */
    public <T> T withRunLock(String runId, Supplier<T> work) {
        ReentrantLock lock = runLocks.computeIfAbsent(runDir(runId).getFileName().toString(),
            id -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the composed arrays and deletes any smooth arrays left by an earlier composition
     * of the same run.
     */
    public void saveComposed(String runId, Trajectory trajectory, MotionVectorSeries motions) {
        Path dir = runDir(runId);
        NpyArrays.writeTrajectory(dir.resolve(TRAJECTORY_FILE), trajectory);
        NpyArrays.writeMotions(dir.resolve(VECTORS_FILE), motions);
        int removed = deleteSmoothArrays(dir);
        log.debug("[Store] composed arrays written. runId={} rows={} staleSmoothRemoved={}",
            runId, trajectory.size(), removed);
    }

    public Trajectory loadTrajectory(String runId) {
        return NpyArrays.readTrajectory(requireRun(runId).resolve(TRAJECTORY_FILE));
    }

    public MotionVectorSeries loadMotions(String runId) {
        return NpyArrays.readMotions(requireRun(runId).resolve(VECTORS_FILE));
    }

    public void saveSmooth(String runId, SmoothingAlgorithm algorithm, Trajectory smooth) {
        Path file = requireRun(runId).resolve(smoothFileName(algorithm));
        NpyArrays.writeTrajectory(file, smooth);
        log.debug("[Store] smooth array written. runId={} file={}", runId, file.getFileName());
    }

    public boolean hasSmooth(String runId, SmoothingAlgorithm algorithm) {
        return Files.isRegularFile(runDir(runId).resolve(smoothFileName(algorithm)));
    }

    public Trajectory loadSmooth(String runId, SmoothingAlgorithm algorithm) {
        return NpyArrays.readTrajectory(requireRun(runId).resolve(smoothFileName(algorithm)));
    }

    public RunManifest readManifest(String runId) {
        Path file = requireRun(runId).resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(file)) {
            throw new StabilizationException(FailureKind.INPUT_NOT_FOUND, STAGE,
                "no manifest for run " + runId);
        }
        try {
            return objectMapper.readValue(file.toFile(), RunManifest.class);
        } catch (IOException e) {
            throw new StabilizationException(FailureKind.CORRUPT_ARRAY, STAGE,
                "manifest for run " + runId + " cannot be read: " + e.getMessage(), e);
        }
    }

    public void writeManifest(RunManifest manifest) {
        Path dir = runDir(manifest.getRunId());
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, "." + MANIFEST_FILE, ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), manifest);
                moveIntoPlace(tmp, dir.resolve(MANIFEST_FILE));
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write manifest for run " + manifest.getRunId(), e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static int deleteSmoothArrays(Path dir) {
        int removed = 0;
        try (DirectoryStream<Path> stale = Files.newDirectoryStream(dir, SMOOTH_GLOB)) {
            for (Path file : stale) {
                Files.deleteIfExists(file);
                removed++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to clear smooth arrays in " + dir, e);
        }
        return removed;
    }

    private Path requireRun(String runId) {
        Path dir = runDir(runId);
        if (!Files.isDirectory(dir)) {
            throw new StabilizationException(FailureKind.INPUT_NOT_FOUND, STAGE,
                "unknown run " + runId);
        }
        return dir;
    }
}
