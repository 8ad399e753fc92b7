package work.pollochang.resize.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import work.pollochang.resize.image.core.DecodedImage;
import work.pollochang.resize.image.core.ImageDecodeException;
import work.pollochang.resize.image.core.StreamOption;
import work.pollochang.resize.image.core.TestImages;
import work.pollochang.resize.image.job.FitMode;
import work.pollochang.resize.image.job.OutputFormat;
import work.pollochang.resize.image.job.ResizeJob;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ImageResizerTest {

    private static final Set<StreamOption> NONE = EnumSet.noneOf(StreamOption.class);

    @TempDir
    Path tempDir;

    private final ImageResizer<DecodedImage> resizer = ImageResizer.withDefaultBackend();

    /**
     * 記錄是否被關閉的輸出串流
     */
    private static class ClosableOutput extends ByteArrayOutputStream {
        boolean closed;

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }

    private Path source(int width, int height) throws IOException {
        return TestImages.writePng(tempDir.resolve("source.png"), width, height, Color.RED);
    }

    @Test
    void testPathToPath_ShouldWriteResizedImage() throws IOException {
        Path output = tempDir.resolve("half.jpg");

        resizer.resize(source(100, 100), NONE, output, ResizeJob.builder().width(50).build());

        BufferedImage result = TestImages.read(output);
        assertEquals(50, result.getWidth());
        assertEquals(50, result.getHeight());
    }

    /**
     * 目的目錄不存在 (應拋出 NoSuchFileException，且不留下任何檔案)
     */
    @Test
    void testMissingDirectory_ShouldFailWithoutCreatingFile() throws IOException {
        Path input = source(100, 100);
        Path output = tempDir.resolve("missing").resolve("out.jpg");

        assertThrows(NoSuchFileException.class,
                () -> resizer.resize(input, NONE, output, ResizeJob.builder().width(50).build()));

        assertFalse(Files.exists(output));
        assertFalse(Files.exists(output.getParent()));
    }

    @Test
    void testCreateDirectory_ShouldCreateMissingParents() throws IOException {
        Path input = source(100, 100);
        Path output = tempDir.resolve("a").resolve("b").resolve("out.png");

        resizer.resize(input, EnumSet.of(StreamOption.CREATE_DESTINATION_DIRECTORY), output,
                ResizeJob.builder().width(10).format(OutputFormat.PNG).build());

        assertTrue(Files.isRegularFile(output));
        assertEquals(10, TestImages.read(output).getWidth());
    }

    /**
     * 來源與目的為同一個檔案，會先讀入記憶體再覆寫
     */
    @Test
    void testSameFile_ShouldOverwriteInPlace() throws IOException {
        Path file = source(100, 80);

        resizer.resize(file, NONE, file, ResizeJob.builder().width(25).format(OutputFormat.PNG).build());

        BufferedImage result = TestImages.read(file);
        assertEquals(25, result.getWidth());
        assertEquals(20, result.getHeight());
    }

    @ParameterizedTest
    @EnumSource(value = FitMode.class, names = {"CROP", "PAD", "STRETCH"})
    void testExactModes_ShouldProduceRequestedSize(FitMode mode) throws IOException {
        Path output = tempDir.resolve(mode.name() + ".png");

        resizer.resize(source(100, 100), NONE, output,
                ResizeJob.builder().width(12).height(34).fitMode(mode).format(OutputFormat.PNG).build());

        BufferedImage result = TestImages.read(output);
        assertEquals(12, result.getWidth());
        assertEquals(34, result.getHeight());
    }

    @Test
    void testMaxMode_ShouldKeepAspectRatio() throws IOException {
        Path output = tempDir.resolve("max.jpg");

        resizer.resize(source(100, 66), NONE, output, ResizeJob.builder().width(12).height(34).build());

        BufferedImage result = TestImages.read(output);
        assertEquals(12, result.getWidth());
        assertEquals(8, result.getHeight());
    }

    @Test
    void testOutOfRangeQuality_ShouldStillEncode() throws IOException {
        Path output = tempDir.resolve("low.jpg");

        resizer.resize(source(60, 60), NONE, output, ResizeJob.builder().width(30).quality(-300).build());

        assertEquals(30, TestImages.read(output).getWidth());
    }

    @Test
    void testStreamDestination_ShouldBeClosedByDefault() throws IOException {
        ClosableOutput out = new ClosableOutput();

        resizer.resize(new ByteArrayInputStream(TestImages.pngBytes(40, 40, Color.RED)), NONE, out,
                ResizeJob.builder().width(20).build());

        assertTrue(out.closed);
        assertEquals(20, TestImages.read(out.toByteArray()).getWidth());
    }

    @Test
    void testStreamDestination_LeaveOpen() throws IOException {
        ClosableOutput out = new ClosableOutput();

        resizer.resize(new ByteArrayInputStream(TestImages.pngBytes(40, 40, Color.RED)),
                EnumSet.of(StreamOption.LEAVE_DESTINATION_OPEN), out, ResizeJob.builder().width(20).build());

        assertFalse(out.closed);
        assertTrue(out.size() > 0);
    }

    /**
     * 保持開啟並還原位置後，同一個串流可以再讀一次
     */
    @Test
    void testStreamSource_LeaveOpenAndRewind_ShouldAllowSecondRead() throws IOException {
        byte[] png = TestImages.pngBytes(40, 40, Color.RED);
        ByteArrayInputStream in = new ByteArrayInputStream(png);
        Set<StreamOption> options = EnumSet.of(StreamOption.LEAVE_SOURCE_OPEN, StreamOption.REWIND_SOURCE);

        resizer.resize(in, options, tempDir.resolve("first.jpg"), ResizeJob.builder().width(10).build());
        assertEquals(png.length, in.available());

        resizer.resize(in, options, tempDir.resolve("second.jpg"), ResizeJob.builder().width(20).build());
        assertEquals(20, TestImages.read(tempDir.resolve("second.jpg")).getWidth());
    }

    @Test
    void testCallback_ShouldReceiveRenderedImage() throws IOException {
        AtomicInteger width = new AtomicInteger();

        resizer.resize(source(100, 50), EnumSet.of(StreamOption.LEAVE_DESTINATION_OPEN),
                ResizeJob.builder().width(40).build(), image -> width.set(image.width()));

        assertEquals(40, width.get());
    }

    @Test
    void testCorruptSource_ShouldNotCreateDestination() throws IOException {
        Path corrupt = tempDir.resolve("corrupt.jpg");
        Files.write(corrupt, "garbage".getBytes(StandardCharsets.US_ASCII));
        Path output = tempDir.resolve("out.jpg");

        assertThrows(ImageDecodeException.class,
                () -> resizer.resize(corrupt, NONE, output, ResizeJob.builder().width(10).build()));

        assertFalse(Files.exists(output));
    }

    @Test
    void testMissingSource_ShouldThrowNoSuchFile() {
        assertThrows(NoSuchFileException.class,
                () -> resizer.resize(tempDir.resolve("nope.png"), NONE, tempDir.resolve("out.jpg"),
                        ResizeJob.builder().build()));
    }

    @Test
    void testNullInputs_ShouldThrowNullPointerException() throws IOException {
        Path input = source(10, 10);
        Path output = tempDir.resolve("out.jpg");
        ResizeJob job = ResizeJob.builder().build();

        assertThrows(NullPointerException.class, () -> resizer.resize((Path) null, NONE, output, job));
        assertThrows(NullPointerException.class, () -> resizer.resize(input, null, output, job));
        assertThrows(NullPointerException.class, () -> resizer.resize(input, NONE, (Path) null, job));
        assertThrows(NullPointerException.class, () -> resizer.resize(input, NONE, output, null));
        assertThrows(NullPointerException.class, () -> new ImageResizer<DecodedImage>(null));
    }

    /**
     * 選項為 null 時，在開啟來源檔案之前就拋出 NullPointerException
     */
    @Test
    void testNullOptions_ShouldFailBeforeOpeningSource() {
        Path missing = tempDir.resolve("not-opened.png");
        ResizeJob job = ResizeJob.builder().build();

        assertThrows(NullPointerException.class, () -> resizer.resize(missing, null, tempDir.resolve("out.jpg"), job));
        assertThrows(NullPointerException.class, () -> resizer.resize(missing, null, new ByteArrayOutputStream(), job));
        assertThrows(NullPointerException.class, () -> resizer.resize(missing, null, job, image -> { }));
    }
}
