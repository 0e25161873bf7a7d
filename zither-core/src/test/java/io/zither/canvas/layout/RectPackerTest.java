package io.zither.canvas.layout;

import io.zither.canvas.model.PaneRecord;
import io.zither.canvas.model.Size;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for RectPacker.
 */
class RectPackerTest {

    private static PackResult pack(Map<String, Size> sizes, Size container, PackOptions options) {
        return RectPacker.pack(new ArrayList<>(sizes.keySet()), container, sizes::get, options);
    }

    private static Map<String, Size> sizes(Object... idsAndSizes) {
        Map<String, Size> sizes = new LinkedHashMap<>();
        for (int i = 0; i < idsAndSizes.length; i += 2) {
            sizes.put((String) idsAndSizes[i], (Size) idsAndSizes[i + 1]);
        }
        return sizes;
    }

    private static void assertNoOverlap(PackResult result, double padding) {
        List<Placement> fitted = result.placements().stream().filter(Placement::fitted).toList();
        for (int i = 0; i < fitted.size(); i++) {
            for (int j = i + 1; j < fitted.size(); j++) {
                assertFalse(fitted.get(i).overlaps(fitted.get(j), padding),
                        fitted.get(i) + " overlaps " + fitted.get(j));
            }
        }
    }

    @Nested
    @DisplayName("Basic packing")
    class BasicPacking {

        @Test
        void emptyInputYieldsEmptyResult() {
            PackResult result = RectPacker.pack(List.<String>of(), new Size(500, 500), id -> null, PackOptions.defaults());
            assertTrue(result.placements().isEmpty());
            assertTrue(result.allFit());
            assertEquals(0.0, result.utilization());
        }

        @Test
        void singleItemGoesToMarginCorner() {
            PackResult result = pack(sizes("a", new Size(200, 100)), new Size(1000, 1000), PackOptions.defaults());
            Placement a = result.placementFor("a").orElseThrow();
            assertEquals(16, a.x());
            assertEquals(16, a.y());
            assertEquals(200, a.width());
            assertEquals(100, a.height());
            assertTrue(a.fitted());
            assertTrue(result.allFit());
        }

        @Test
        void largestItemIsPlacedFirst() {
            PackResult result = pack(sizes(
                    "small", new Size(100, 100),
                    "large", new Size(400, 300)), new Size(1000, 1000), PackOptions.tight());
            assertEquals("large", result.placements().get(0).itemId());
            assertEquals(0, result.placementFor("large").orElseThrow().x());
            assertEquals(0, result.placementFor("large").orElseThrow().y());
        }

        @Test
        void unsizedItemsUseMinimumSize() {
            Map<String, Size> sizes = new HashMap<>();
            sizes.put("zero", Size.ZERO);
            sizes.put("missing", null);
            PackResult result = RectPacker.pack(List.of("zero", "missing"), new Size(1000, 1000),
                    sizes::get, PackOptions.defaults());
            for (Placement p : result.placements()) {
                assertEquals(100, p.width());
                assertEquals(80, p.height());
            }
        }

        @Test
        void packsPanesBySize() {
            List<PaneRecord> panes = List.of(
                    PaneRecord.builder("p1").size(300, 200).build(),
                    PaneRecord.builder("p2").size(300, 200).build());
            PackResult result = RectPacker.pack(panes, new Size(600, 200), PackOptions.tight());
            assertTrue(result.allFit());
            assertEquals(1.0, result.utilization(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Known layouts")
    class KnownLayouts {

        @Test
        void twoSmallItemsShareTheRowBelowTheLargeOne() {
            PackResult result = pack(sizes(
                    "s1", new Size(300, 200),
                    "s2", new Size(300, 200),
                    "big", new Size(600, 200)), new Size(600, 400), PackOptions.tight());

            assertTrue(result.allFit());
            assertEquals(1.0, result.utilization(), 1e-9);
            Placement big = result.placementFor("big").orElseThrow();
            Placement s1 = result.placementFor("s1").orElseThrow();
            Placement s2 = result.placementFor("s2").orElseThrow();
            assertEquals(0, big.x());
            assertEquals(0, big.y());
            assertEquals(200, s1.y());
            assertEquals(200, s2.y());
            assertEquals(0, s1.x());
            assertEquals(300, s2.x());
        }

        @Test
        void wideContainerLeavesHalfUnused() {
            // Only 600 x 400 of the 1200 x 400 container is covered
            PackResult result = pack(sizes(
                    "s1", new Size(300, 200),
                    "s2", new Size(300, 200),
                    "big", new Size(600, 200)), new Size(1200, 400), PackOptions.tight());

            assertTrue(result.allFit());
            assertEquals(0.5, result.utilization(), 1e-9);
            assertEquals(200, result.placementFor("s1").orElseThrow().y());
            assertEquals(200, result.placementFor("s2").orElseThrow().y());
            assertNoOverlap(result, 0);
        }

        @Test
        void oversizedItemFallsBackToMarginOrigin() {
            PackResult result = pack(sizes("huge", new Size(2000, 2000)), new Size(100, 100), PackOptions.defaults());

            assertFalse(result.allFit());
            Placement huge = result.placementFor("huge").orElseThrow();
            assertFalse(huge.fitted());
            assertEquals(16, huge.x());
            assertEquals(16, huge.y());
            assertEquals(0.0, result.utilization());
            assertEquals(1, result.overflowCount());
        }

        @Test
        void stackBelowPlacesOverflowUnderLowestItem() {
            PackResult result = pack(sizes(
                    "fits", new Size(200, 100),
                    "wide", new Size(5000, 2)), new Size(400, 300), PackOptions.defaults());

            Placement fits = result.placementFor("fits").orElseThrow();
            Placement wide = result.placementFor("wide").orElseThrow();
            assertFalse(wide.fitted());
            assertEquals(16, wide.x());
            assertEquals(fits.bottom() + 8, wide.y());
        }

        @Test
        void paddingSeparatesNeighbours() {
            PackResult result = pack(sizes(
                    "a", new Size(100, 100),
                    "b", new Size(100, 100)), new Size(1000, 150), PackOptions.defaults().withMargin(0));

            Placement a = result.placementFor("a").orElseThrow();
            Placement b = result.placementFor("b").orElseThrow();
            assertEquals(0, a.x());
            assertEquals(108, b.x());
            assertNoOverlap(result, 8);
        }
    }

    @Nested
    @DisplayName("Shelf overflow")
    class ShelfOverflow {

        @Test
        void shelfNeverOverlaps() {
            PackOptions options = PackOptions.defaults().withOverflowPolicy(OverflowPolicy.SHELF);
            PackResult result = pack(sizes(
                    "a", new Size(300, 300),
                    "b", new Size(300, 300),
                    "c", new Size(300, 300),
                    "d", new Size(300, 300)), new Size(500, 500), options);

            assertFalse(result.allFit());
            List<Placement> all = result.placements();
            for (int i = 0; i < all.size(); i++) {
                for (int j = i + 1; j < all.size(); j++) {
                    assertFalse(all.get(i).overlaps(all.get(j), 8), all.get(i) + " overlaps " + all.get(j));
                }
            }
        }

        @Test
        void shelfStartsBelowFittedItems() {
            PackOptions options = PackOptions.defaults().withOverflowPolicy(OverflowPolicy.SHELF);
            PackResult result = pack(sizes(
                    "fits", new Size(200, 200),
                    "wide1", new Size(900, 50),
                    "wide2", new Size(900, 50)), new Size(400, 400), options);

            Placement fits = result.placementFor("fits").orElseThrow();
            Placement wide1 = result.placementFor("wide1").orElseThrow();
            Placement wide2 = result.placementFor("wide2").orElseThrow();
            assertEquals(fits.bottom() + 8, wide1.y());
            // each wide item exceeds the row, so each starts its own shelf
            assertEquals(wide1.bottom() + 8, wide2.y());
            assertEquals(16, wide2.x());
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        void randomInputsNeverOverlapAndStayInBounds() {
            Random random = new Random(42);
            for (int run = 0; run < 50; run++) {
                Map<String, Size> sizes = new LinkedHashMap<>();
                int count = 1 + random.nextInt(15);
                for (int i = 0; i < count; i++) {
                    sizes.put("item-" + i, new Size(20 + random.nextInt(300), 20 + random.nextInt(300)));
                }
                Size container = new Size(200 + random.nextInt(1000), 200 + random.nextInt(1000));
                PackResult result = pack(sizes, container, PackOptions.defaults());

                assertEquals(count, result.placements().size());
                assertNoOverlap(result, 8);
                assertTrue(result.utilization() >= 0 && result.utilization() <= 1);
                for (Placement p : result.placements()) {
                    if (p.fitted()) {
                        assertTrue(p.x() >= 16 && p.y() >= 16, p.toString());
                        assertTrue(p.right() <= container.width() - 16, p.toString());
                        assertTrue(p.bottom() <= container.height() - 16, p.toString());
                    }
                }
                boolean anyOverflow = result.placements().stream().anyMatch(p -> !p.fitted());
                assertEquals(!anyOverflow, result.allFit());
            }
        }

        @Test
        void samePackTwiceGivesSameResult() {
            Map<String, Size> sizes = sizes(
                    "a", new Size(120, 80),
                    "b", new Size(80, 120),
                    "c", new Size(120, 80),
                    "d", new Size(300, 40));
            PackResult first = pack(sizes, new Size(400, 300), PackOptions.defaults());
            PackResult second = pack(sizes, new Size(400, 300), PackOptions.defaults());
            assertEquals(first, second);
        }

        @Test
        void equalAreasKeepInputOrder() {
            PackResult result = pack(sizes(
                    "first", new Size(100, 100),
                    "second", new Size(100, 100),
                    "third", new Size(100, 100)), new Size(1000, 1000), PackOptions.tight());
            assertEquals(List.of("first", "second", "third"),
                    result.placements().stream().map(Placement::itemId).toList());
        }

        @Test
        void containerSmallerThanMarginsOverflowsEverything() {
            PackResult result = pack(sizes("a", new Size(10, 10)), new Size(20, 20), PackOptions.defaults());
            assertFalse(result.allFit());
            assertEquals(0.0, result.utilization());
        }
    }
}
