package com.videostab.core.io;

import com.videostab.core.exception.FailureKind;
import com.videostab.core.exception.StabilizationException;
import com.videostab.core.model.MotionVectorSeries;
import com.videostab.core.model.RelativeMotion;
import com.videostab.core.model.Trajectory;
import com.videostab.core.pose.ComposedTrajectory;
import com.videostab.core.pose.PoseComposer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class NpyArraysTest {

    @TempDir
    Path dir;

    /** Hand-built v1.0 file with an arbitrary header dict and big-endian payload. */
    private static byte[] npy(String dict, ByteOrder order, double... values) {
        byte[] header = (dict + "\n").getBytes(StandardCharsets.US_ASCII);
        ByteBuffer buffer = ByteBuffer.allocate(10 + header.length + values.length * 8);
        buffer.put(new byte[] {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 1, 0});
        buffer.order(ByteOrder.LITTLE_ENDIAN).putShort((short) header.length);
        buffer.put(header);
        buffer.order(order);
        for (double v : values) {
            buffer.putDouble(v);
        }
        return buffer.array();
    }

    @Nested
    @DisplayName("file round trip")
    class FileTests {

        @Test
        @DisplayName("composed trajectory and motion series survive write → read")
        void trajectoryAndMotions() {
            ComposedTrajectory composed = PoseComposer.compose(List.of(
                new RelativeMotion(1.5, -0.25, 0.01), new RelativeMotion(2.0, 0.5, -0.02),
                new RelativeMotion(-0.75, 0.0, 0.0)));
            Path trajectoryFile = dir.resolve("run-1/trajectory_X_act.npy");
            Path motionsFile = dir.resolve("run-1/vectors_V_act.npy");

            NpyArrays.writeTrajectory(trajectoryFile, composed.trajectory());
            NpyArrays.writeMotions(motionsFile, composed.motions());

            assertEquals(composed.trajectory(), NpyArrays.readTrajectory(trajectoryFile));
            MotionVectorSeries motions = NpyArrays.readMotions(motionsFile);
            assertEquals(composed.motions(), motions);
            assertTrue(motions.get(0).isZero());
        }

        @Test
        @DisplayName("missing file → INPUT_NOT_FOUND")
        void missingFile() {
            StabilizationException e = assertThrows(StabilizationException.class,
                () -> NpyArrays.readTrajectory(dir.resolve("absent.npy")));
            assertEquals(FailureKind.INPUT_NOT_FOUND, e.getKind());
        }

        @Test
        @DisplayName("wrong column count → CORRUPT_ARRAY")
        void wrongColumns() {
            Path file = dir.resolve("two-columns.npy");
            NpyArrays.write(file, new double[][] {{1, 2}, {3, 4}}, 2);

            StabilizationException e = assertThrows(StabilizationException.class,
                () -> NpyArrays.read(file, 3));
            assertEquals(FailureKind.CORRUPT_ARRAY, e.getKind());
        }

        @Test
        @DisplayName("garbage bytes → CORRUPT_ARRAY")
        void garbage() throws IOException {
            Path file = dir.resolve("garbage.npy");
            Files.write(file, "not an array".getBytes(StandardCharsets.US_ASCII));

            StabilizationException e = assertThrows(StabilizationException.class,
                () -> NpyArrays.readTrajectory(file));
            assertEquals(FailureKind.CORRUPT_ARRAY, e.getKind());
        }

        @Test
        @DisplayName("rewrite replaces the file and leaves no temporary siblings")
        void rewriteLeavesNoTemporaries() throws IOException {
            Path file = dir.resolve("smooth.npy");
            NpyArrays.write(file, new double[][] {{1, 2, 3}}, 3);
            NpyArrays.write(file, new double[][] {{4, 5, 6}, {7, 8, 9}}, 3);

            assertEquals(2, NpyArrays.read(file, 3).length);
            try (Stream<Path> listing = Files.list(dir)) {
                assertEquals(List.of(file), listing.toList());
            }
        }

        @Test
        @DisplayName("unwritable target → UncheckedIOException, not a decoding failure")
        void unwritableTarget() throws IOException {
            Path blocker = dir.resolve("blocker");
            Files.writeString(blocker, "plain file");

            assertThrows(UncheckedIOException.class,
                () -> NpyArrays.write(blocker.resolve("nested.npy"), new double[][] {{1, 2, 3}}, 3));
        }
    }

    @Nested
    @DisplayName("codec")
    class CodecTests {

        @Test
        @DisplayName("writes a v1.0 <f8 C-order header padded to 64 bytes")
        void headerLayout() {
            byte[] bytes = NpyArrays.encode(new double[][] {{1, 2, 3}, {4, 5, 6}}, 3);

            assertEquals((byte) 0x93, bytes[0]);
            assertEquals("NUMPY", new String(bytes, 1, 5, StandardCharsets.US_ASCII));
            assertEquals(1, bytes[6]);
            assertEquals(0, bytes[7]);
            int headerLength = (bytes[8] & 0xFF) | (bytes[9] & 0xFF) << 8;
            assertEquals(0, (10 + headerLength) % 64);
            String header = new String(bytes, 10, headerLength, StandardCharsets.US_ASCII);
            assertTrue(header.startsWith("{'descr': '<f8', 'fortran_order': False, 'shape': (2, 3), }"));
            assertTrue(header.endsWith("\n"));
            assertEquals(10 + headerLength + 6 * 8, bytes.length);
        }

        @Test
        @DisplayName("empty array keeps its (0, 3) shape")
        void emptyArray() {
            double[][] rows = NpyArrays.decode(NpyArrays.encode(new double[0][], 3), "empty");
            assertEquals(0, rows.length);
        }

        @Test
        @DisplayName("reads big-endian Fortran-order arrays")
        void bigEndianFortran() {
            // column-major storage of [[1, 2, 3], [4, 5, 6]]
            byte[] bytes = npy("{'descr': '>f8', 'fortran_order': True, 'shape': (2, 3), }",
                ByteOrder.BIG_ENDIAN, 1, 4, 2, 5, 3, 6);

            double[][] rows = NpyArrays.decode(bytes, "fortran");

            assertArrayEquals(new double[] {1, 2, 3}, rows[0]);
            assertArrayEquals(new double[] {4, 5, 6}, rows[1]);
        }

        @Test
        @DisplayName("non-float64 dtype → CORRUPT_ARRAY")
        void wrongDtype() {
            byte[] bytes = npy("{'descr': '<f4', 'fortran_order': False, 'shape': (1, 3), }",
                ByteOrder.LITTLE_ENDIAN);
            StabilizationException e = assertThrows(StabilizationException.class,
                () -> NpyArrays.decode(bytes, "f4"));
            assertEquals(FailureKind.CORRUPT_ARRAY, e.getKind());
        }

        @Test
        @DisplayName("payload shorter than the declared shape → CORRUPT_ARRAY")
        void truncatedPayload() {
            byte[] full = NpyArrays.encode(new double[][] {{1, 2, 3}, {4, 5, 6}}, 3);
            byte[] truncated = Arrays.copyOf(full, full.length - 8);

            StabilizationException e = assertThrows(StabilizationException.class,
                () -> NpyArrays.decode(truncated, "truncated"));
            assertEquals(FailureKind.CORRUPT_ARRAY, e.getKind());
        }

        @Test
        @DisplayName("shape dimension beyond int range → CORRUPT_ARRAY")
        void oversizedDimension() {
            byte[] bytes = npy("{'descr': '<f8', 'fortran_order': False, 'shape': (99999999999, 3), }",
                ByteOrder.LITTLE_ENDIAN);
            StabilizationException e = assertThrows(StabilizationException.class,
                () -> NpyArrays.decode(bytes, "huge"));
            assertEquals(FailureKind.CORRUPT_ARRAY, e.getKind());
        }

        @Test
        @DisplayName("negative v2 header length → CORRUPT_ARRAY")
        void negativeHeaderLength() {
            ByteBuffer buffer = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
            buffer.put(new byte[] {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 2, 0});
            buffer.putInt(-5);
            StabilizationException e = assertThrows(StabilizationException.class,
                () -> NpyArrays.decode(buffer.array(), "v2"));
            assertEquals(FailureKind.CORRUPT_ARRAY, e.getKind());
        }

        @Test
        @DisplayName("ragged rows are rejected on write")
        void raggedRows() {
            assertThrows(IllegalArgumentException.class,
                () -> NpyArrays.encode(new double[][] {{1, 2, 3}, {4, 5}}, 3));
        }

        @Test
        @DisplayName("trajectory built from rows matches the decoded rows")
        void rowsToTrajectory() {
            double[][] rows = {{0, 0, 0}, {1.25, -3.5, 0.125}};
            Trajectory trajectory = Trajectory.ofRows(NpyArrays.decode(NpyArrays.encode(rows, 3), "mem"));
            assertArrayEquals(rows, trajectory.toRows());
        }
    }
}
