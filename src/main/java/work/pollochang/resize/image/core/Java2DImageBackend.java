package work.pollochang.resize.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.resize.image.job.OutputFormat;
import work.pollochang.resize.image.layout.PixelSize;
import work.pollochang.resize.image.layout.Rect;

import javax.imageio.IIOException;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Iterator;

/**
 * 使用 ImageIO 與 Java2D 的後端實作。
 *
 * <p>繪製使用雙三次插值。輸出 JPEG 時使用不含 alpha 的畫布，若背景為透明且畫布有未被
 * 內容完全覆蓋的部分，背景改為白色。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class Java2DImageBackend implements ImageBackend<DecodedImage> {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    @Override
    public DecodedImage decode(InputStream source, boolean honorColorProfile) throws IOException {
        ImageInputStream in = ImageIO.createImageInputStream(source);
        if (in == null) {
            throw new ImageDecodeException("無法建立圖片輸入流");
        }

        // 關閉 ImageInputStream 不會關閉來源串流
        try (in) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new ImageDecodeException("找不到對應的圖片讀取器 (不支援的格式或檔案損毀)");
            }

            ImageReader reader = readers.next();
            try {
                // 忽略色彩描述檔時一併略過中繼資料
                reader.setInput(in, true, !honorColorProfile);
                BufferedImage image = reader.read(0, reader.getDefaultReadParam());
                log.debug("解碼完成: {} {}x{}", reader.getFormatName(), image.getWidth(), image.getHeight());
                return new DecodedImage(image, reader);
            } catch (IIOException | RuntimeException e) {
                reader.dispose();
                throw new ImageDecodeException("圖片解碼失敗", e);
            } catch (IOException e) {
                reader.dispose();
                throw e;
            }
        }
    }

    @Override
    public DecodedImage render(DecodedImage source, Rect copyRegion, PixelSize canvasSize, Rect targetRegion,
                               Color background, OutputFormat format) throws IOException {
        BufferedImage sourceImage = source.image();
        int imageType = format.supportsTransparency() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;

        BufferedImage canvas;
        try {
            canvas = new BufferedImage(canvasSize.width(), canvasSize.height(), imageType);
        } catch (RuntimeException e) {
            throw new ImageRenderException("無法建立 " + canvasSize + " 畫布", e);
        }

        Graphics2D g2d = canvas.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_ALPHA_INTERPOLATION, RenderingHints.VALUE_ALPHA_INTERPOLATION_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_COLOR_RENDERING, RenderingHints.VALUE_COLOR_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);

            Color fill = background;
            if (fill.getAlpha() == 0 && !format.supportsTransparency()
                    && !coversCanvas(sourceImage, canvasSize, targetRegion)) {
                fill = Color.WHITE;
            }
            if (fill.getAlpha() != 0) {
                g2d.setColor(fill);
                g2d.fillRect(0, 0, canvasSize.width(), canvasSize.height());
            }

            // 將 copyRegion 對應到 targetRegion，超出的部分由 clip 切掉
            AffineTransform transform = new AffineTransform();
            transform.translate(targetRegion.x(), targetRegion.y());
            transform.scale(targetRegion.width() / copyRegion.width(), targetRegion.height() / copyRegion.height());
            transform.translate(-copyRegion.x(), -copyRegion.y());

            g2d.clip(new Rectangle2D.Double(targetRegion.x(), targetRegion.y(), targetRegion.width(), targetRegion.height()));
            g2d.drawImage(sourceImage, transform, null);
        } catch (RuntimeException e) {
            canvas.flush();
            throw new ImageRenderException("繪製縮放圖片失敗", e);
        } finally {
            g2d.dispose();
        }

        return new DecodedImage(canvas);
    }

    @Override
    public void encode(DecodedImage image, OutputFormat format, int quality, OutputStream target) throws IOException {
        try {
            if (format.isLossy()) {
                writeWithQuality(image.image(), format, quality / 100f, target);
            } else if (!ImageIO.write(image.image(), format.getFormatName(), target)) {
                throw new ImageEncodeException("找不到 " + format + " 格式的寫入器");
            }
        } catch (IIOException | RuntimeException e) {
            throw new ImageEncodeException("圖片編碼為 " + format + " 失敗", e);
        }
    }

    /**
     * 以指定品質寫出，{@code quality} 範圍 0.0f 到 1.0f。
     */
    private static void writeWithQuality(BufferedImage image, OutputFormat format, float quality, OutputStream os) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getFormatName());
        if (!writers.hasNext()) {
            throw new ImageEncodeException("找不到 " + format + " 格式的寫入器");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(os)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    /**
     * 來源沒有透明度且內容完全覆蓋畫布時，背景不會露出。
     */
    private static boolean coversCanvas(BufferedImage source, PixelSize canvasSize, Rect targetRegion) {
        return !source.getColorModel().hasAlpha()
                && targetRegion.x() == 0 && targetRegion.y() == 0
                && targetRegion.width() == canvasSize.width()
                && targetRegion.height() == canvasSize.height();
    }
}
