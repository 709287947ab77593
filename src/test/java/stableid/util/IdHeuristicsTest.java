package stableid.util;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class IdHeuristicsTest {

    @Test
    public void isDynamicId_detectsCountersHashesAndFrameworkIds() {
        assertThat(IdHeuristics.isDynamicId("item-42")).isTrue();
        assertThat(IdHeuristics.isDynamicId("list-item-42")).isTrue();
        assertThat(IdHeuristics.isDynamicId("field_7")).isTrue();
        assertThat(IdHeuristics.isDynamicId("12345")).isTrue();
        assertThat(IdHeuristics.isDynamicId(":r1:")).isTrue();
        assertThat(IdHeuristics.isDynamicId("550e8400-e29b-41d4-a716-446655440000")).isTrue();
        assertThat(IdHeuristics.isDynamicId("a3f9c2d18b7e4f60")).isTrue();
        assertThat(IdHeuristics.isDynamicId("radix-menu")).isTrue();
        assertThat(IdHeuristics.isDynamicId("mui-17")).isTrue();
        assertThat(IdHeuristics.isDynamicId("abC12345678")).isTrue();
    }

    @Test
    public void isDynamicId_acceptsHandWrittenIds() {
        assertThat(IdHeuristics.isDynamicId("login-form")).isFalse();
        assertThat(IdHeuristics.isDynamicId("main")).isFalse();
        assertThat(IdHeuristics.isDynamicId("searchInput")).isFalse();
        assertThat(IdHeuristics.isDynamicId("submit_button")).isFalse();
    }

    @Test
    public void isStableId_rejectsBlankAndNull() {
        assertThat(IdHeuristics.isStableId(null)).isFalse();
        assertThat(IdHeuristics.isStableId("  ")).isFalse();
        assertThat(IdHeuristics.isStableId("checkout")).isTrue();
    }

    @Test
    public void hasDynamicIdReference_checksEveryReferencedId() {
        assertThat(IdHeuristics.hasDynamicIdReference("main-title")).isFalse();
        assertThat(IdHeuristics.hasDynamicIdReference("main-title label-1")).isTrue();
        assertThat(IdHeuristics.hasDynamicIdReference("")).isFalse();
    }
}
