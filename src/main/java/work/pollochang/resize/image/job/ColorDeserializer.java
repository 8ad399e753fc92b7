package work.pollochang.resize.image.job;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.awt.Color;
import java.io.IOException;

/**
 * 將 JSON 中的色彩字串 (例如 {@code "#ffffff"}、{@code "transparent"}) 還原成 {@link Color}。
 */
public class ColorDeserializer extends JsonDeserializer<Color> {

    @Override
    public Color deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        String value = parser.getValueAsString();
        if (value == null) {
            return null;
        }
        try {
            return ResizeInstructions.parseColor(value);
        } catch (IllegalArgumentException e) {
            throw new IOException("無法將字串反序列化為顏色: " + value, e);
        }
    }
}
