package com.texturecritter.server.tools;

import com.texturecritter.image.DecodedImage;
import com.texturecritter.image.ImageCodec;
import com.texturecritter.image.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class TextureExpandTest {

    @TempDir
    Path tempDir;

    @Test
    void testParseOptions() {
        TextureExpand.Options options = TextureExpand.parse(new String[] {
                "in.png", "--radius", "3", "out.png", "--scale", "4", "--target", "t.png", "--threads", "2",
                "--timeout", "60" });
        assertEquals(Paths.get("in.png"), options.input);
        assertEquals(Paths.get("out.png"), options.output);
        assertEquals(Paths.get("t.png"), options.target);
        assertEquals(3, options.radius);
        assertEquals(4, options.scale);
        assertEquals(2, options.threads);
        assertEquals(60L, options.timeoutSeconds);
    }

    @Test
    void testParseRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> TextureExpand.parse(new String[] { "in.png" }));
        assertThrows(IllegalArgumentException.class,
                () -> TextureExpand.parse(new String[] { "in.png", "out.png", "extra.png" }));
        assertThrows(IllegalArgumentException.class,
                () -> TextureExpand.parse(new String[] { "in.png", "out.png", "--radius" }));
        assertThrows(IllegalArgumentException.class,
                () -> TextureExpand.parse(new String[] { "in.png", "out.png", "--radius", "-1" }));
        assertThrows(IllegalArgumentException.class,
                () -> TextureExpand.parse(new String[] { "in.png", "out.png", "--scale", "two" }));
        assertThrows(IllegalArgumentException.class,
                () -> TextureExpand.parse(new String[] { "in.png", "out.png", "--verbose", "1" }));
    }

    @Test
    void testRunGenerative() throws Exception {
        Path in = tempDir.resolve("in.png");
        Path out = tempDir.resolve("out.png");
        Files.write(in, TestImages.png(TestImages.gradientRgb(3, 3)));

        int status = TextureExpand.run(new String[] { in.toString(), out.toString(), "--scale", "2", "--radius", "1" });

        assertEquals(0, status);
        DecodedImage written = ImageCodec.decode(out);
        assertEquals(6, written.getWidth());
        assertEquals(6, written.getHeight());
    }

    @Test
    void testRunTargeted() throws Exception {
        Path in = tempDir.resolve("in.png");
        Path target = tempDir.resolve("target.png");
        Path out = tempDir.resolve("out.png");
        Files.write(in, TestImages.png(TestImages.gradientRgb(3, 3)));
        Files.write(target, TestImages.png(TestImages.uniformRgb(4, 2, 0x808080)));

        int status = TextureExpand.run(new String[] { in.toString(), out.toString(), "--target", target.toString() });

        assertEquals(0, status);
        assertEquals(4, ImageCodec.decode(out).getWidth());
    }

    @Test
    void testRunFailsCleanly() throws Exception {
        Path out = tempDir.resolve("out.png");
        assertEquals(1, TextureExpand.run(new String[] { tempDir.resolve("missing.png").toString(), out.toString() }));

        Path garbage = tempDir.resolve("garbage.png");
        Files.write(garbage, new byte[] { 0, 1, 2 });
        assertEquals(1, TextureExpand.run(new String[] { garbage.toString(), out.toString() }));
        assertFalse(Files.exists(out));

        assertEquals(1, TextureExpand.run(new String[0]));
    }
}
