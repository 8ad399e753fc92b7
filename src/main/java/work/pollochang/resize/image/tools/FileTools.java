package work.pollochang.resize.image.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.util.Locale;

@Slf4j
public class FileTools {

    /**
     * 確保指定的目錄存在，如果不存在則建立它。
     * @param directoryPath 要檢查或建立的目錄路徑
     * @throws IOException 無法建立目錄
     */
    public static void ensureDirectoryExists(Path directoryPath) throws IOException {
        if (!Files.isDirectory(directoryPath)) {
            Files.createDirectories(directoryPath);
            log.info("{} - 目標目錄已建立", directoryPath);
        } else {
            log.debug("{} - 目標目錄已存在", directoryPath);
        }
    }

    /**
     * 換掉檔名的副檔名，例如 {@code photo.jpeg} + {@code png} -> {@code photo.png}。
     */
    public static String replaceExtension(String fileName, String extension) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return base + "." + extension.toLowerCase(Locale.ROOT);
    }

    public static String formatFileSize(long size) {
        if (size <= 0) return "0 B";
        final String[] units = new String[]{"B", "KB", "MB", "GB", "TB"};
        int digitGroups = (int) (Math.log10(size) / Math.log10(1024));
        return new DecimalFormat("#,##0.#").format(size / Math.pow(1024, digitGroups)) + " " + units[digitGroups];
    }

}
