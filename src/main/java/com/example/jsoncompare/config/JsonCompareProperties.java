package com.example.jsoncompare.config;

import com.example.jsoncompare.domain.CompareOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from {@code json-compare.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "json-compare")
public class JsonCompareProperties {
    private Render render = new Render();
    private Options options = new Options();

    public CompareOptions defaultOptions() {
        return new CompareOptions(
                options.isIgnoreKeyOrder(), options.isIgnoreArrayOrder(), options.isStrictType());
    }

    @Getter
    @Setter
    public static class Render {
        /** Unchanged lines kept visible on each side of a changed line. */
        private int contextLines = 3;
        private int maxDisplayLines = 5000;
        private int defaultIndentWidth = 4;
        /** Largest indent width a request may ask for. */
        private int maxIndentWidth = 16;
    }

    @Getter
    @Setter
    public static class Options {
        private boolean ignoreKeyOrder = true;
        private boolean ignoreArrayOrder = false;
        private boolean strictType = true;
    }
}
