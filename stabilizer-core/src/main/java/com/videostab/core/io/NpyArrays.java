package com.videostab.core.io;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.Trajectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reader/writer for two-dimensional float64 arrays in the NumPy {@code .npy} format, the
 * interchange format for trajectories and motion-vector series shared with external tools.
 *
 * <p>Writes version 1.0, dtype {@code <f8}, C order, header padded to a 64-byte boundary.
 * Reads versions 1.x–3.x, either byte order of {@code f8}, and both C and Fortran order.
 */
public final class NpyArrays {

    private static final Logger log = LoggerFactory.getLogger(NpyArrays.class);

    private static final String STAGE = "npy";

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final int ALIGNMENT = 64;

    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([<>|=])f8'");
    private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,?\\s*\\)");

    private NpyArrays() {}

    public static Trajectory readTrajectory(Path path) {
        return Trajectory.ofRows(read(path, Trajectory.AXES));
    }

    public static MotionVectorSeries readMotions(Path path) {
        return MotionVectorSeries.ofRows(read(path, Trajectory.AXES));
    }

    public static void writeTrajectory(Path path, Trajectory trajectory) {
        write(path, trajectory.toRows(), Trajectory.AXES);
    }

    public static void writeMotions(Path path, MotionVectorSeries motions) {
        write(path, motions.toRows(), Trajectory.AXES);
    }

    /**
     * Reads a 2-D array and checks its column count.
     *
     * @throws StabilizationException {@link FailureKind#INPUT_NOT_FOUND} when the file is missing,
     *         {@link FailureKind#CORRUPT_ARRAY} when it cannot be decoded or has the wrong shape
     */
    public static double[][] read(Path path, int expectedColumns) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new StabilizationException(FailureKind.INPUT_NOT_FOUND, STAGE,
                "array not found: " + path, e);
        } catch (IOException e) {
            throw new StabilizationException(FailureKind.CORRUPT_ARRAY, STAGE,
                "cannot read " + path + ": " + e.getMessage(), e);
        }
        double[][] rows = decode(bytes, path.toString());
        int columns = rows.length == 0 ? expectedColumns : rows[0].length;
        if (columns != expectedColumns) {
            throw new StabilizationException(FailureKind.CORRUPT_ARRAY, STAGE,
                path + " has " + columns + " columns, expected " + expectedColumns);
        }
        log.debug("Read array. path={} rows={}", path, rows.length);
        return rows;
    }

    /**
     * Writes a 2-D array. The bytes go to a temporary sibling first and are moved over
     * {@code path}, so concurrent readers see either the previous file or the new one.
     *
     * @throws UncheckedIOException when the file system rejects the write
     */
    public static void write(Path path, double[][] rows, int columns) {
        byte[] bytes = encode(rows, columns);
        Path target = path.toAbsolutePath();
        Path tmp = null;
        try {
            Path parent = target.getParent();
            Files.createDirectories(parent);
            tmp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
            Files.write(tmp, bytes);
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new UncheckedIOException("cannot write " + path, e);
        }
        log.debug("Wrote array. path={} rows={}", path, rows.length);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp, IOException cause) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException suppressed) {
            cause.addSuppressed(suppressed);
        }
    }

    // ── Codec ──────────────────────────────────────────────────────────────

    static byte[] encode(double[][] rows, int columns) {
        String dict = "{'descr': '<f8', 'fortran_order': False, 'shape': ("
            + rows.length + ", " + columns + "), }";
        int unpadded = MAGIC.length + 2 + 2 + dict.length() + 1;
        int padding = (ALIGNMENT - unpadded % ALIGNMENT) % ALIGNMENT;
        String header = dict + " ".repeat(padding) + "\n";
        byte[] headerBytes = header.getBytes(StandardCharsets.US_ASCII);

        ByteBuffer buffer = ByteBuffer
            .allocate(MAGIC.length + 4 + headerBytes.length + rows.length * columns * Double.BYTES)
            .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(MAGIC);
        buffer.put((byte) 1).put((byte) 0);
        buffer.putShort((short) headerBytes.length);
        buffer.put(headerBytes);
        for (double[] row : rows) {
            if (row.length != columns) {
                throw new IllegalArgumentException("Ragged row of length " + row.length
                    + ", expected " + columns);
            }
            for (double value : row) {
                buffer.putDouble(value);
            }
        }
        return buffer.array();
    }

    static double[][] decode(byte[] bytes, String source) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        try {
            for (byte expected : MAGIC) {
                if (buffer.get() != expected) {
                    throw corrupt(source, "missing NPY magic string");
                }
            }
            int major = buffer.get() & 0xFF;
            buffer.get(); // minor
            int headerLength;
            if (major == 1) {
                headerLength = buffer.getShort() & 0xFFFF;
            } else if (major == 2 || major == 3) {
                headerLength = buffer.getInt();
            } else {
                throw corrupt(source, "unsupported NPY version " + major);
            }
            if (headerLength < 0 || headerLength > buffer.remaining()) {
                throw corrupt(source, "header length " + headerLength + " exceeds the file");
            }
            byte[] headerBytes = new byte[headerLength];
            buffer.get(headerBytes);
            String header = new String(headerBytes, major == 3
                ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

            Matcher descr = DESCR.matcher(header);
            Matcher fortran = FORTRAN.matcher(header);
            Matcher shape = SHAPE.matcher(header);
            if (!descr.find()) throw corrupt(source, "dtype is not float64: " + header.trim());
            if (!fortran.find()) throw corrupt(source, "missing fortran_order: " + header.trim());
            if (!shape.find()) throw corrupt(source, "array is not two-dimensional: " + header.trim());

            ByteOrder order = ">".equals(descr.group(1)) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
            boolean fortranOrder = "True".equals(fortran.group(1));
            int rowCount = dimension(shape.group(1), source);
            int columnCount = dimension(shape.group(2), source);

            ByteBuffer data = buffer.slice().order(order);
            if (data.remaining() < (long) rowCount * columnCount * Double.BYTES) {
                throw corrupt(source, "truncated data for shape (" + rowCount + ", " + columnCount + ")");
            }
            double[][] rows = new double[rowCount][columnCount];
            if (fortranOrder) {
                for (int c = 0; c < columnCount; c++) {
                    for (int r = 0; r < rowCount; r++) {
                        rows[r][c] = data.getDouble();
                    }
                }
            } else {
                for (int r = 0; r < rowCount; r++) {
                    for (int c = 0; c < columnCount; c++) {
                        rows[r][c] = data.getDouble();
                    }
                }
            }
            return rows;
        } catch (BufferUnderflowException e) {
            throw new StabilizationException(FailureKind.CORRUPT_ARRAY, STAGE,
                source + " is truncated", e);
        }
    }

    private static int dimension(String digits, String source) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new StabilizationException(FailureKind.CORRUPT_ARRAY, STAGE,
                source + ": shape dimension " + digits + " is out of range", e);
        }
    }

    private static StabilizationException corrupt(String source, String reason) {
        return new StabilizationException(FailureKind.CORRUPT_ARRAY, STAGE, source + ": " + reason);
    }
}
