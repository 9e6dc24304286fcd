package io.datashape.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.datashape.core.model.Undefined;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Values")
class ValuesTest {

    @Nested
    @DisplayName("deepCopy")
    class DeepCopy {

        @Test
        void copiesNestedContainers() {
            Map<String, Object> inner = new LinkedHashMap<>();
            inner.put("list", new ArrayList<>(List.of(1, 2)));
            Map<String, Object> original = new LinkedHashMap<>();
            original.put("inner", inner);

            Object copy = Values.deepCopy(original);

            assertThat(copy).isEqualTo(original).isNotSameAs(original);
            @SuppressWarnings("unchecked")
            Map<String, Object> copiedInner = (Map<String, Object>) ((Map<?, ?>) copy).get("inner");
            assertThat(copiedInner).isNotSameAs(inner);
            assertThat(copiedInner.get("list")).isNotSameAs(inner.get("list"));
        }

        @Test
        void copiesDatesAndSets() {
            Date date = new Date(0);
            Set<Object> set = Set.of("a");

            assertThat(Values.deepCopy(date)).isEqualTo(date).isNotSameAs(date);
            assertThat(Values.deepCopy(set)).isEqualTo(set).isNotSameAs(set);
        }

        @Test
        void leavesImmutableValuesAlone() {
            assertThat(Values.deepCopy("x")).isSameAs("x");
            assertThat(Values.deepCopy(Undefined.INSTANCE)).isSameAs(Undefined.INSTANCE);
        }
    }

    @Test
    void truthiness() {
        assertThat(Values.isTruthy(null)).isFalse();
        assertThat(Values.isTruthy(Undefined.INSTANCE)).isFalse();
        assertThat(Values.isTruthy(false)).isFalse();
        assertThat(Values.isTruthy(0)).isFalse();
        assertThat(Values.isTruthy(Double.NaN)).isFalse();
        assertThat(Values.isTruthy("")).isFalse();
        assertThat(Values.isTruthy(BigInteger.ZERO)).isFalse();
        assertThat(Values.isTruthy("false")).isTrue();
        assertThat(Values.isTruthy(List.of())).isTrue();
        assertThat(Values.isTruthy(-1)).isTrue();
    }

    @Test
    void primitiveEqualsComparesNumbersByValue() {
        assertThat(Values.primitiveEquals(1, 1L)).isTrue();
        assertThat(Values.primitiveEquals(1, 1.0d)).isTrue();
        assertThat(Values.primitiveEquals(new BigDecimal("2.50"), 2.5d)).isTrue();
        assertThat(Values.primitiveEquals(Double.NaN, Double.NaN)).isFalse();
        assertThat(Values.primitiveEquals(BigInteger.ONE, 1)).isFalse();
        assertThat(Values.primitiveEquals("1", 1)).isFalse();
        assertThat(Values.primitiveEquals(null, null)).isTrue();
    }

    @Test
    void literalize() {
        assertThat(Values.literalize("a\"b")).isEqualTo("\"a\\\"b\"");
        assertThat(Values.literalize(BigInteger.TEN)).isEqualTo("10n");
        assertThat(Values.literalize(null)).isEqualTo("null");
        assertThat(Values.literalizeAll(List.of("a", 1))).isEqualTo("\"a\" | 1");
    }

    @Test
    void compareOrdersNumbersNumerically() {
        List<Object> values = new ArrayList<>(List.of(10, 2.5, 3L));
        values.sort(Values::compare);

        assertThat(values).containsExactly(2.5, 3L, 10);
        assertThat(Values.compare("b", "a")).isPositive();
    }

    @Test
    @DisplayName("mixed values sort by type rank first, so the order stays transitive")
    void compareRanksMixedTypes() {
        assertThat(Values.compare(9, "9")).isNegative();
        assertThat(Values.compare("9", 10)).isPositive();
        assertThat(Values.compare(9, 10)).isNegative();
        assertThat(Values.compare(null, 1)).isNegative();
        assertThat(Values.compare(Double.NaN, 1)).isPositive();
        assertThat(Values.compare(Double.NaN, "a")).isNegative();

        List<Object> values = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            values.add(i % 3 == 0 ? String.valueOf(i) : i % 3 == 1 ? (Object) i : Boolean.valueOf(i % 2 == 0));
        }
        Collections.shuffle(values, new Random(42));
        values.sort(Values::compare);

        assertThat(values.subList(0, 67)).allSatisfy(v -> assertThat(v).isInstanceOf(Integer.class));
        assertThat(values.get(67)).isEqualTo(Boolean.FALSE);
        assertThat(values.get(values.size() - 1)).isInstanceOf(String.class);
    }

    @Test
    void asListViewsArrays() {
        assertThat(Values.asList(new Object[] {1, 2})).containsExactly(1, 2);
        assertThat(Values.asList(List.of("a"))).containsExactly("a");
    }
}
