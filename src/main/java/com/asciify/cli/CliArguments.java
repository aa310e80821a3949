package com.asciify.cli;

import com.asciify.pipeline.ConfigurationException;
import com.asciify.pipeline.RenderConfig;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * {@code <path-or-url> [width] [--color] [--invert] [--detailed] [--sharpen] [--dither[=amount]]
 * [--contrast=f] [--brightness=f] [--charset=chars]}
 */
@AllArgsConstructor
@Getter
public class CliArguments {
    public static final String USAGE = "Usage: AsciiMain <path-or-url> [width] [--color] [--invert] [--detailed] "
            + "[--sharpen] [--dither[=amount]] [--contrast=f] [--brightness=f] [--charset=chars]";

    /** Same ceiling as {@code asciify.max-width} on the REST API. */
    public static final int MAX_WIDTH = 400;

    private final String source;
    private final RenderConfig config;

    /**
     * @throws ConfigurationException on unknown flags, unparsable numbers or out-of-range values
     */
    public static CliArguments parse(String[] args) {
        String source = null;
        RenderConfig.RenderConfigBuilder builder = RenderConfig.builder();

        for (String arg : args) {
            if (!arg.startsWith("--")) {
                if (source == null) {
                    source = arg;
                } else {
                    builder.width(parseWidth(arg));
                }
                continue;
            }
            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (eq >= 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }
            switch (name) {
                case "--color":
                    builder.colorMode(true);
                    break;
                case "--invert":
                    builder.invertBrightness(true);
                    break;
                case "--detailed":
                    builder.useDetailedCharSet(true);
                    break;
                case "--sharpen":
                    builder.applySharpening(true);
                    break;
                case "--dither":
                    builder.applyDithering(true);
                    if (value != null) builder.ditherAmount(parseDouble("dither", value));
                    break;
                case "--contrast":
                    builder.contrastFactor(parseDouble("contrast", require(name, value)));
                    break;
                case "--brightness":
                    builder.brightnessFactor(parseDouble("brightness", require(name, value)));
                    break;
                case "--charset":
                    builder.charSet(require(name, value));
                    break;
                default:
                    throw new ConfigurationException("Unknown option " + name);
            }
        }
        if (source == null) {
            throw new ConfigurationException("No image given");
        }
        return new CliArguments(source, builder.build());
    }

    private static String require(String name, String value) {
        if (value == null) {
            throw new ConfigurationException(name + " needs a value, e.g. " + name + "=1.2");
        }
        return value;
    }

    private static int parseWidth(String value) {
        int width;
        try {
            width = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid width: " + value);
        }
        if (width > MAX_WIDTH) {
            throw new ConfigurationException("Width must be at most " + MAX_WIDTH + " cells: " + width);
        }
        return width;
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + name + ": " + value);
        }
    }
}
