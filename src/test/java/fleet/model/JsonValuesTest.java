package fleet.model;

import fleet.session.LocatorKind;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class JsonValuesTest {

    @Test(description = "Scalars, lists and string-keyed maps are representable")
    public void testRepresentableValues() {
        assertThat(JsonValues.isRepresentable(null)).isTrue();
        assertThat(JsonValues.isRepresentable("text")).isTrue();
        assertThat(JsonValues.isRepresentable(5)).isTrue();
        assertThat(JsonValues.isRepresentable(2.5)).isTrue();
        assertThat(JsonValues.isRepresentable(true)).isTrue();
        assertThat(JsonValues.isRepresentable(List.of(1, "a", List.of(false)))).isTrue();
        assertThat(JsonValues.isRepresentable(Map.of("k", Map.of("n", 1)))).isTrue();
    }

    @Test(description = "Objects, NaN and maps with non-string keys are not representable")
    public void testNonRepresentableValues() {
        assertThat(JsonValues.isRepresentable(new Object())).isFalse();
        assertThat(JsonValues.isRepresentable(Double.NaN)).isFalse();
        assertThat(JsonValues.isRepresentable(Map.of(1, "one"))).isFalse();
        assertThat(JsonValues.isRepresentable(List.of("ok", new Object()))).isFalse();
    }

    @Test(description = "filterArgs drops non-representable entries and keeps order")
    public void testFilterArgs() {
        List<Object> args = new ArrayList<>(Arrays.asList("#q", new Object(), null, 500));

        assertThat(JsonValues.filterArgs(args)).containsExactly("#q", null, 500);
    }

    @Test(description = "Arrays are copied as lists")
    public void testArraysBecomeLists() {
        List<Object> filtered = JsonValues.filterArgs(Collections.singletonList(new Object[]{"a", 1}));

        assertThat(filtered).hasSize(1);
        assertThat(filtered.get(0)).isEqualTo(List.of("a", 1));
    }

    @Test(description = "filterKwargs drops keys with non-representable values")
    public void testFilterKwargs() {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("timeout", 5);
        kwargs.put("callback", (Runnable) () -> { });
        kwargs.put("by", "css");

        assertThat(JsonValues.filterKwargs(kwargs))
                .containsOnlyKeys("timeout", "by")
                .containsEntry("timeout", 5);
    }

    @Test(description = "Enum values are kept under their name")
    public void testEnumsKeptByName() {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("by", LocatorKind.XPATH);
        kwargs.put("kinds", List.of(LocatorKind.ID, "css"));

        assertThat(JsonValues.isRepresentable(LocatorKind.NAME)).isTrue();
        assertThat(JsonValues.filterKwargs(kwargs))
                .containsEntry("by", "XPATH")
                .containsEntry("kinds", List.of("ID", "css"));
    }

    @Test(description = "Null inputs give empty copies")
    public void testNullInputs() {
        assertThat(JsonValues.filterArgs(null)).isEmpty();
        assertThat(JsonValues.filterKwargs(null)).isEmpty();
    }
}
