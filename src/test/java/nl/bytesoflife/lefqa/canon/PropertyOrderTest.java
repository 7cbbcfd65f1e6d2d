package nl.bytesoflife.lefqa.canon;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PropertyOrderTest {

    static Stream<Arguments> cellKeywordPairs() {
        List<String> cell = PropertyOrder.CELL;
        return IntStream.range(0, cell.size()).boxed()
                .flatMap(i -> IntStream.range(i + 1, cell.size())
                        .mapToObj(j -> Arguments.of(cell.get(i), cell.get(j))));
    }

    @ParameterizedTest
    @MethodSource("cellKeywordPairs")
    void earlierListedKeySortsFirstRegardlessOfInputOrder(String first, String second) {
        Comparator<String> order = PropertyOrder.cellProperties();
        String a = "  " + first + " x ;";
        String b = "  " + second + " a ;";
        assertTrue(order.compare(a, b) < 0);
        assertTrue(order.compare(b, a) > 0);
    }

    @Test
    void unlistedKeySortsAfterEveryListedKey() {
        for (String listed : PropertyOrder.PIN) {
            assertEquals(1, PropertyOrder.compare(PropertyOrder.PIN, "AAA", listed, -1));
            assertEquals(-1, PropertyOrder.compare(PropertyOrder.PIN, listed, "AAA", 1));
        }
    }

    @Test
    void unlistedKeysFallBackToTiebreak() {
        assertEquals(-7, PropertyOrder.compare(PropertyOrder.CELL, "FOO", "BAR", -7));
        assertEquals(3, PropertyOrder.compare(PropertyOrder.CELL, "SIZE", "SIZE", 3));
    }

    @Test
    void pinPropertiesUseUpperCasedKeyword() {
        List<String> lines = new ArrayList<>(List.of(
                "    use SIGNAL ;",
                "    ANTENNAGATEAREA 0.1 ;",
                "    SHAPE ABUTMENT ;",
                "    direction INPUT ;",
                "    WEIRD 1 ;"));
        lines.sort(PropertyOrder.pinProperties());
        assertEquals(List.of(
                "    direction INPUT ;",
                "    use SIGNAL ;",
                "    SHAPE ABUTMENT ;",
                "    ANTENNAGATEAREA 0.1 ;",
                "    WEIRD 1 ;"), lines);
    }

    @Test
    void layerNamesFollowTheActiveOrderThenName() {
        List<String> names = new ArrayList<>(List.of("zeta", "VI1", "alpha", "ME1", "CONT"));
        names.sort(PropertyOrder.layerNames(List.of("CONT", "ME1", "VI1")));
        assertEquals(List.of("CONT", "ME1", "VI1", "alpha", "zeta"), names);
    }
}
