package io.zither.canvas.coord;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkCoordTest {

    @ParameterizedTest
    @CsvSource({
            "0, 0, 0, 0, 0",
            "0, 0, 3, -1, 3",
            "-2, 5, 1, 1, 4",
            "7, 7, 7, -7, 14"
    })
    void chebyshevDistanceIsMaxAxisDelta(int ax, int ay, int bx, int by, long expected) {
        ChunkCoord a = new ChunkCoord(ax, ay);
        ChunkCoord b = new ChunkCoord(bx, by);
        assertEquals(expected, a.chebyshevDistance(b));
        assertEquals(expected, b.chebyshevDistance(a));
    }

    @Test
    void chebyshevDistanceDoesNotOverflowAtIntExtremes() {
        ChunkCoord min = new ChunkCoord(Integer.MIN_VALUE, 0);
        ChunkCoord max = new ChunkCoord(Integer.MAX_VALUE, 0);
        assertEquals(4294967295L, min.chebyshevDistance(max));
    }

    @Test
    void offsetShiftsWithinRange() {
        assertEquals(Optional.of(new ChunkCoord(2, -3)), new ChunkCoord(1, 1).offset(1, -4));
    }

    @Test
    void offsetOutOfIntRangeIsEmpty() {
        assertTrue(new ChunkCoord(Integer.MAX_VALUE, 0).offset(1, 0).isEmpty());
        assertTrue(new ChunkCoord(0, Integer.MIN_VALUE).offset(0, -1).isEmpty());
    }

    @Test
    void orderingIsByXThenY() {
        List<ChunkCoord> coords = new ArrayList<>(List.of(
                new ChunkCoord(1, 0), new ChunkCoord(-1, 5), new ChunkCoord(1, -2), new ChunkCoord(-1, -5)));
        coords.sort(null);
        assertEquals(List.of(
                new ChunkCoord(-1, -5), new ChunkCoord(-1, 5), new ChunkCoord(1, -2), new ChunkCoord(1, 0)), coords);
    }

    @Test
    void equalityFollowsComponents() {
        assertEquals(ChunkCoord.of(3, 4), new ChunkCoord(3, 4));
        assertEquals(ChunkCoord.of(3, 4).hashCode(), new ChunkCoord(3, 4).hashCode());
        assertNotEquals(ChunkCoord.of(3, 4), ChunkCoord.of(4, 3));
    }

    @Test
    void toKeyUsesStorageFormat() {
        assertEquals("-3,12", new ChunkCoord(-3, 12).toKey());
        assertEquals("(-3, 12)", new ChunkCoord(-3, 12).toString());
    }
}
