package work.pollochang.resize.image.core;

public enum ResizeResult {
    RESIZED_SUCCESS("成功縮放"),
    SKIPPED_NOT_FOUND("來源檔案不存在"),
    FAILED_UNSUPPORTED_FORMAT("格式不支援"),
    FAILED_PROCESSING("繪製或編碼失敗"),
    FAILED_IO_ERROR("IO錯誤"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    ResizeResult(String description) { this.description = description; }
    public String getDescription() { return description; }
}
