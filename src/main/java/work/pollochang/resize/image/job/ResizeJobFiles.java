package work.pollochang.resize.image.job;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 從 JSON 檔案讀取縮放參數，例如：
 * <pre>{@code
 * { "width": 320, "height": 240, "fitMode": "crop", "background": "#ffffff", "format": "png" }
 * }</pre>
 */
@Slf4j
public final class ResizeJobFiles {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ResizeJobFiles() {}

    /**
     * @param path JSON 檔案路徑
     * @return 讀取到的縮放參數
     * @throws IOException 檔案不存在、格式錯誤或參數驗證失敗
     */
    public static ResizeJob read(Path path) throws IOException {
        if (!Files.isReadable(path)) {
            throw new IOException("無法讀取縮放參數檔: " + path);
        }
        ResizeJob job = MAPPER.readValue(path.toFile(), ResizeJob.class);
        log.info("成功從 {} 讀取縮放參數: {}", path, job);
        return job;
    }
}
