package com.asciify.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AsciiMainTest {

    private static String writeSplitImage(Path dir) throws Exception {
        // left half white, right half black
        BufferedImage image = new BufferedImage(20, 10, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 20; x++) {
                image.setRGB(x, y, x < 10 ? 0xFFFFFF : 0x000000);
            }
        }
        File file = dir.resolve("split.png").toFile();
        ImageIO.write(image, "png", file);
        return file.getAbsolutePath();
    }

    @Test
    void printsPlainText(@TempDir Path dir) throws Exception {
        String path = writeSplitImage(dir);

        String out = AsciiMain.run(CliArguments.parse(new String[]{path, "4", "--charset=@ "}));

        // 4 columns, floor(4 * 0.5 * 0.5) = 1 row
        assertEquals("@@  \n", out);
    }

    @Test
    void colorUsesAnsiEscapes(@TempDir Path dir) throws Exception {
        String path = writeSplitImage(dir);

        String out = AsciiMain.run(CliArguments.parse(new String[]{path, "8", "--color"}));

        String[] lines = out.split("\n");
        assertEquals(2, lines.length);
        assertTrue(out.contains("\u001b[38;2;255;255;255m"));
        assertTrue(out.contains("\u001b[38;2;0;0;0m"));
    }
}
