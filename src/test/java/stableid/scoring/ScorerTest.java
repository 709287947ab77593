package stableid.scoring;

import org.testng.annotations.Test;
import stableid.model.MatchMode;
import stableid.model.Semantics;
import stableid.model.TextContent;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Scorer} with the default profile.
 */
public class ScorerTest {

    private final Scorer scorer = new Scorer(ScoringProfile.DEFAULT);

    @Test(description = "A node without features scores the base weight")
    public void testEmptySemantics() {
        assertThat(scorer.elementScore(Semantics.EMPTY)).isCloseTo(0.5, within(1e-9));
    }

    @Test(description = "Feature bonus is capped and the total never exceeds 1")
    public void testFullSemanticsCapped() {
        Semantics s = new Semantics("login", List.of("login-form"), Map.of("name", "login"), "form",
                new TextContent("Log in", "Log in", MatchMode.EXACT), null);
        assertThat(scorer.elementScore(s)).isCloseTo(1.0, within(1e-9));
    }

    @Test(description = "The role attribute earns the role bonus but no feature bonus")
    public void testRoleCountsOnce() {
        Semantics s = new Semantics(null, List.of(), Map.of("role", "button"), "button", null, null);
        assertThat(scorer.elementScore(s)).isCloseTo(0.65, within(1e-9));
    }

    @Test
    public void confidence_combinesWeightedStages() {
        assertThat(scorer.confidence(1.0, List.of(), 1.0, 1.0, false)).isCloseTo(0.85, within(1e-9));
        assertThat(scorer.confidence(0.5, List.of(0.4, 0.6), 0.7, 0.0, false))
                .isCloseTo(0.2 + 0.15 + 0.14, within(1e-9));
    }

    @Test
    public void confidence_degradationPenaltyIsClampedAtZero() {
        assertThat(scorer.confidence(0.3, List.of(), 0.5, 0.0, true)).isCloseTo(0.17, within(1e-9));
        assertThat(scorer.confidence(0.0, List.of(), 0.0, 0.0, true)).isZero();
    }

    @Test
    public void weights_rejectOutOfRangeValues() {
        assertThatThrownBy(() -> new MatchWeights(1.5, 0.3, 0.25, 0.2, 0.15, 0.1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("visibility");
        assertThatThrownBy(() -> new AnchorWeights(0.5, 0.3, 0.1, 0.1, 0.05, -1, 0.05, 0.3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfidenceWeights(Double.NaN, 0.3, 0.2, 0.1, 0.5, 0.2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
