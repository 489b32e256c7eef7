package com.texturecritter.server.synthesis;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TextureSynthesizerTest {

    private static PixelGrid uniform(int width, int height, int[] pixel) {
        PixelGrid grid = PixelGrid.blank(width, height, pixel.length == 4);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                grid.set(x, y, pixel);
                grid.markValid(x, y);
            }
        }
        return grid;
    }

    private static PixelGrid pattern(int width, int height) {
        PixelGrid grid = PixelGrid.blank(width, height, false);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                grid.set(x, y, new int[] { (x * 40) % 256, (y * 40) % 256, ((x + y) * 20) % 256 });
                grid.markValid(x, y);
            }
        }
        return grid;
    }

    @Test
    void testUniformSourceFillsCanvas() {
        PixelGrid source = uniform(4, 4, new int[] { 10, 20, 30 });

        SynthesisResult result = new TextureSynthesizer().expandUntargeted(source, 2, 1);

        PixelGrid out = result.getGrid();
        assertEquals(8, out.getWidth());
        assertEquals(8, out.getHeight());
        assertEquals(3, out.getChannelCount());
        assertTrue(result.isComplete());
        assertEquals(64, result.getCommittedPixels());
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                assertArrayEquals(new int[] { 10, 20, 30 }, out.get(x, y));
                assertTrue(out.isValid(x, y));
            }
        }
    }

    @Test
    void testGenerativeRunIsDeterministic() {
        PixelGrid source = pattern(5, 4);

        byte[] first = new TextureSynthesizer().expandUntargeted(source, 2, 2).getGrid().toImage().getRawBytes();
        byte[] second = new TextureSynthesizer().expandUntargeted(source, 2, 2).getGrid().toImage().getRawBytes();

        assertArrayEquals(first, second);
    }

    @Test
    void testParallelScanMatchesSequential() {
        PixelGrid source = pattern(6, 5);

        PixelGrid sequential = new TextureSynthesizer(1, 0).expandUntargeted(source, 2, 1).getGrid();
        PixelGrid parallel = new TextureSynthesizer(4, 0).expandUntargeted(source, 2, 1).getGrid();

        assertArrayEquals(sequential.toImage().getRawBytes(), parallel.toImage().getRawBytes());
    }

    @Test
    void testParallelTargetedMatchesSequential() {
        PixelGrid source = pattern(6, 6);
        PixelGrid target = uniform(5, 5, new int[] { 90, 60, 30 });

        PixelGrid sequential = new TextureSynthesizer(1, 0).expandTargeted(source, target.copy(), 1).getGrid();
        PixelGrid parallel = new TextureSynthesizer(3, 0).expandTargeted(source, target.copy(), 1).getGrid();

        assertArrayEquals(sequential.toImage().getRawBytes(), parallel.toImage().getRawBytes());
    }

    @Test
    void testFirstPixelWithoutContextTakesFirstSourcePixel() {
        PixelGrid source = pattern(3, 3);
        PixelGrid canvas = PixelGrid.blank(1, 1, false);

        new TextureSynthesizer().expand(source, canvas, NeighbourhoodShape.causalEll(1));

        assertArrayEquals(source.get(0, 0), canvas.get(0, 0));
        assertTrue(canvas.isValid(0, 0));
    }

    @Test
    void testEqualScoresPickFirstInScanOrder() {
        PixelGrid source = PixelGrid.blank(3, 1, false);
        source.set(0, 0, new int[] { 200, 200, 200 });
        source.set(1, 0, new int[] { 0, 10, 10 });
        source.set(2, 0, new int[] { 20, 10, 10 });
        for (int x = 0; x < 3; x++) {
            source.markValid(x, 0);
        }
        // both (0,10,10) and (20,10,10) are at distance 100
        PixelGrid target = uniform(1, 1, new int[] { 10, 10, 10 });

        new TextureSynthesizer().expandTargeted(source, target, 0);
        assertArrayEquals(new int[] { 0, 10, 10 }, target.get(0, 0));

        PixelGrid parallelTarget = uniform(1, 1, new int[] { 10, 10, 10 });
        new TextureSynthesizer(2, 0).expandTargeted(source, parallelTarget, 0);
        assertArrayEquals(new int[] { 0, 10, 10 }, parallelTarget.get(0, 0));
    }

    @Test
    void testTargetedPicksClosestColour() {
        PixelGrid source = PixelGrid.blank(3, 1, false);
        source.set(0, 0, new int[] { 0, 0, 0 });
        source.set(1, 0, new int[] { 100, 100, 100 });
        source.set(2, 0, new int[] { 200, 200, 200 });
        for (int x = 0; x < 3; x++) {
            source.markValid(x, 0);
        }
        PixelGrid target = uniform(2, 2, new int[] { 90, 90, 90 });

        SynthesisResult result = new TextureSynthesizer().expandTargeted(source, target, 0);

        assertTrue(result.isComplete());
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 2; x++) {
                assertArrayEquals(new int[] { 100, 100, 100 }, result.getGrid().get(x, y));
            }
        }
    }

    @Test
    void testTargetConvertedToSourceMode() {
        PixelGrid source = uniform(2, 2, new int[] { 1, 2, 3 });
        PixelGrid target = uniform(3, 3, new int[] { 9, 9, 9, 128 });

        SynthesisResult result = new TextureSynthesizer().expandTargeted(source, target, 1);

        assertEquals(3, result.getGrid().getChannelCount());
        assertArrayEquals(new int[] { 1, 2, 3 }, result.getGrid().get(2, 2));
        // the caller's grid is left in its own mode
        assertEquals(4, target.getChannelCount());
    }

    @Test
    void testAlphaSourceGrowsAlphaCanvas() {
        PixelGrid source = uniform(2, 2, new int[] { 5, 6, 7, 8 });
        SynthesisResult result = new TextureSynthesizer().expandUntargeted(source, 3, 1);
        assertEquals(4, result.getGrid().getChannelCount());
        assertEquals(6, result.getGrid().getWidth());
        assertArrayEquals(new int[] { 5, 6, 7, 8 }, result.getGrid().get(5, 5));
    }

    @Test
    void testCancelledRunLeavesScanOrderPrefix() {
        PixelGrid source = pattern(4, 4);
        AtomicInteger checks = new AtomicInteger();

        SynthesisResult result = new TextureSynthesizer().expandUntargeted(source, 2, 1,
                () -> checks.incrementAndGet() > 10);

        assertFalse(result.isComplete());
        assertEquals(10, result.getCommittedPixels());
        PixelGrid grid = result.getGrid();
        assertEquals(10, grid.validCount());
        int scanIndex = 0;
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                assertEquals(scanIndex < 10, grid.isValid(x, y), "pixel (" + x + "," + y + ")");
                scanIndex++;
            }
        }
    }

    @Test
    void testInvalidArguments() {
        PixelGrid source = pattern(2, 2);
        assertThrows(IllegalArgumentException.class, () -> new TextureSynthesizer(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new TextureSynthesizer().expandUntargeted(source, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new TextureSynthesizer().expandUntargeted(source, 2, -1));
    }

    @Test
    void testOverflowingScaleRejected() {
        PixelGrid source = pattern(2, 2);
        assertThrows(IllegalArgumentException.class,
                () -> new TextureSynthesizer().expandUntargeted(source, Integer.MAX_VALUE, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new TextureSynthesizer().expandUntargeted(source, 40000, 1));
    }
}
