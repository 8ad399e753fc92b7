package work.pollochang.resize.image.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import work.pollochang.resize.image.job.OutputFormat;
import work.pollochang.resize.image.job.ResizeJob;
import work.pollochang.resize.image.layout.PixelSize;
import work.pollochang.resize.image.layout.Rect;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class Java2DImageBackendTest {

    private final Java2DImageBackend backend = new Java2DImageBackend();

    private DecodedImage decodePng(int width, int height, Color color) throws IOException {
        return backend.decode(new ByteArrayInputStream(TestImages.pngBytes(width, height, color)), true);
    }

    @Test
    void testDecode_ShouldReadDimensions() throws IOException {
        try (DecodedImage image = decodePng(100, 66, Color.RED)) {
            assertEquals(100, image.width());
            assertEquals(66, image.height());
            assertNotNull(image.reader());
        }
    }

    @Test
    void testDecode_IgnoringColorProfile_ShouldStillDecode() throws IOException {
        byte[] png = TestImages.pngBytes(20, 10, Color.GREEN);

        try (DecodedImage image = backend.decode(new ByteArrayInputStream(png), false)) {
            assertEquals(20, image.width());
        }
    }

    /**
     * 非圖片內容 (應拋出 ImageDecodeException)
     */
    @Test
    void testDecode_Garbage_ShouldThrowDecodeException() {
        byte[] garbage = "this is not an image".getBytes(StandardCharsets.US_ASCII);

        assertThrows(ImageDecodeException.class, () -> backend.decode(new ByteArrayInputStream(garbage), true));
    }

    @Test
    void testDecode_TruncatedPng_ShouldThrowIOException() throws IOException {
        byte[] png = TestImages.pngBytes(50, 50, Color.BLUE);
        byte[] truncated = Arrays.copyOf(png, 40);

        assertThrows(IOException.class, () -> backend.decode(new ByteArrayInputStream(truncated), true));
    }

    @Test
    void testRender_ShouldScaleToCanvas() throws IOException {
        try (DecodedImage source = decodePng(100, 100, Color.RED);
             DecodedImage rendered = backend.render(source, new Rect(0, 0, 100, 100), new PixelSize(50, 50),
                     new Rect(0, 0, 50, 50), ResizeJob.TRANSPARENT, OutputFormat.PNG)) {
            assertEquals(50, rendered.width());
            assertEquals(50, rendered.height());
            assertNull(rendered.reader());

            Color center = new Color(rendered.image().getRGB(25, 25), true);
            assertTrue(center.getRed() > 200 && center.getGreen() < 50 && center.getBlue() < 50, center.toString());
        }
    }

    /**
     * 補邊的部分填入背景色
     */
    @Test
    void testRender_Pad_ShouldFillBackground() throws IOException {
        try (DecodedImage source = decodePng(100, 100, Color.RED);
             DecodedImage rendered = backend.render(source, new Rect(0, 0, 100, 100), new PixelSize(12, 34),
                     new Rect(0, 11, 12, 12), Color.BLUE, OutputFormat.PNG)) {
            BufferedImage image = rendered.image();

            assertEquals(Color.BLUE.getRGB(), image.getRGB(6, 0));
            assertEquals(Color.BLUE.getRGB(), image.getRGB(6, 33));
            Color center = new Color(image.getRGB(6, 17), true);
            assertTrue(center.getRed() > 200 && center.getBlue() < 50, center.toString());
        }
    }

    @Test
    void testRender_PngTransparentPad_ShouldKeepAlpha() throws IOException {
        try (DecodedImage source = decodePng(100, 100, Color.RED);
             DecodedImage rendered = backend.render(source, new Rect(0, 0, 100, 100), new PixelSize(12, 34),
                     new Rect(0, 11, 12, 12), ResizeJob.TRANSPARENT, OutputFormat.PNG)) {
            assertEquals(0, new Color(rendered.image().getRGB(6, 0), true).getAlpha());
        }
    }

    /**
     * JPEG 不支援透明度，透明背景改為白色
     */
    @Test
    void testRender_JpegTransparentPad_ShouldUseWhite() throws IOException {
        try (DecodedImage source = decodePng(100, 100, Color.RED);
             DecodedImage rendered = backend.render(source, new Rect(0, 0, 100, 100), new PixelSize(12, 34),
                     new Rect(0, 11, 12, 12), ResizeJob.TRANSPARENT, OutputFormat.JPEG)) {
            assertEquals(BufferedImage.TYPE_INT_RGB, rendered.image().getType());
            assertEquals(Color.WHITE.getRGB(), rendered.image().getRGB(6, 0));
        }
    }

    @Test
    void testRender_Crop_ShouldSampleCopyRegionOnly() throws IOException {
        // 左半紅、右半藍，只取右半
        BufferedImage split = TestImages.createTestImage(100, 50, Color.RED);
        for (int x = 50; x < 100; x++) {
            for (int y = 0; y < 50; y++) {
                split.setRGB(x, y, Color.BLUE.getRGB());
            }
        }
        try (DecodedImage source = new DecodedImage(split);
             DecodedImage rendered = backend.render(source, new Rect(50, 0, 50, 50), new PixelSize(10, 10),
                     new Rect(0, 0, 10, 10), ResizeJob.TRANSPARENT, OutputFormat.PNG)) {
            Color center = new Color(rendered.image().getRGB(5, 5), true);
            assertTrue(center.getBlue() > 200 && center.getRed() < 50, center.toString());
        }
    }

    @Test
    void testEncode_Png() throws IOException {
        try (DecodedImage image = decodePng(30, 20, Color.RED)) {
            ByteArrayOutputStream bos = new ByteArrayOutputStream();
            backend.encode(image, OutputFormat.PNG, 90, bos);

            byte[] bytes = bos.toByteArray();
            assertEquals((byte) 0x89, bytes[0]);
            assertEquals('P', bytes[1]);
            BufferedImage decoded = TestImages.read(bytes);
            assertEquals(30, decoded.getWidth());
            assertEquals(20, decoded.getHeight());
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 50, 100})
    void testEncode_JpegAtAnyQuality(int quality) throws IOException {
        try (DecodedImage source = decodePng(40, 40, Color.RED);
             DecodedImage rendered = backend.render(source, new Rect(0, 0, 40, 40), new PixelSize(40, 40),
                     new Rect(0, 0, 40, 40), ResizeJob.TRANSPARENT, OutputFormat.JPEG)) {
            ByteArrayOutputStream bos = new ByteArrayOutputStream();
            backend.encode(rendered, OutputFormat.JPEG, quality, bos);

            byte[] bytes = bos.toByteArray();
            assertEquals((byte) 0xFF, bytes[0]);
            assertEquals((byte) 0xD8, bytes[1]);
            assertEquals(40, TestImages.read(bytes).getWidth());
        }
    }

    @Test
    void testEncode_HigherQuality_ShouldNotBeSmaller() throws IOException {
        BufferedImage noisy = TestImages.createTestImage(64, 64, Color.WHITE);
        for (int x = 0; x < 64; x++) {
            for (int y = 0; y < 64; y++) {
                noisy.setRGB(x, y, (x * 31 + y * 17) % 2 == 0 ? 0x123456 : 0xFEDCBA);
            }
        }
        try (DecodedImage image = new DecodedImage(noisy)) {
            ByteArrayOutputStream low = new ByteArrayOutputStream();
            ByteArrayOutputStream high = new ByteArrayOutputStream();
            backend.encode(image, OutputFormat.JPEG, 10, low);
            backend.encode(image, OutputFormat.JPEG, 95, high);

            assertTrue(high.size() > low.size(), "low " + low.size() + " high " + high.size());
        }
    }
}
