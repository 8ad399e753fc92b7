package work.pollochang.resize.image.report;

import work.pollochang.resize.image.core.ResizeResult;

public record ResizeReport(ResizeResult result, long originalSize, long resizedSize) {}
