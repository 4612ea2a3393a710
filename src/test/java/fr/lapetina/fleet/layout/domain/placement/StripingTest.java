package fr.lapetina.fleet.layout.domain.placement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StripingTest {

    @Test
    @DisplayName("should interleave groups of different lengths")
    void shouldInterleaveGroups() {
        List<String> striped = Striping.stripe(List.of(
                List.of("a1", "a2", "a3"),
                List.of("b1"),
                List.of("c1", "c2")));

        assertThat(striped).containsExactly("a1", "b1", "c1", "a2", "c2", "a3");
    }

    @Test
    @DisplayName("should keep a single group unchanged")
    void shouldKeepSingleGroup() {
        assertThat(Striping.stripe(List.of(List.of(3, 1, 2)))).containsExactly(3, 1, 2);
    }

    @Test
    @DisplayName("should skip empty groups")
    void shouldSkipEmptyGroups() {
        List<String> striped = Striping.stripe(List.of(
                List.of(),
                List.of("b1", "b2"),
                List.of(),
                List.of("d1")));

        assertThat(striped).containsExactly("b1", "d1", "b2");
    }

    @Test
    @DisplayName("should return an empty list for no groups")
    void shouldHandleNoGroups() {
        assertThat(Striping.<String>stripe(List.of())).isEmpty();
    }
}
