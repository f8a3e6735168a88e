package com.example.videodata.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PaginatorTest {

    @Test
    void collectStopsWhenNextTokenIsEmpty() {
        ScriptedPages pages = new ScriptedPages();

        List<String> items = Paginator.collect(pages, 5);

        assertThat(items).containsExactly("a1", "a2", "b1", "c1", "c2", "c3");
        assertThat(pages.requestedTokens).containsExactly("", "page-2", "page-3");
    }

    @Test
    void collectStopsAtPageCap() {
        ScriptedPages pages = new ScriptedPages();

        List<String> items = Paginator.collect(pages, 2);

        assertThat(items).containsExactly("a1", "a2", "b1");
        assertThat(pages.requestedTokens).hasSize(2);
    }

    @Test
    void collectWithNonPositiveCapFetchesNothing() {
        ScriptedPages pages = new ScriptedPages();

        assertThat(Paginator.collect(pages, 0)).isEmpty();
        assertThat(pages.requestedTokens).isEmpty();
    }

    @Test
    void collectAllFollowsTokensUntilExhausted() {
        ScriptedPages pages = new ScriptedPages();

        assertThat(Paginator.collectAll(pages)).hasSize(6);
        assertThat(pages.requestedTokens).hasSize(3);
    }

    @Test
    void collectPropagatesFirstFailure() {
        List<String> requested = new ArrayList<>();
        Paginator.PageFetcher<String> failing = token -> {
            requested.add(token);
            if (!token.isEmpty()) {
                throw new IllegalStateException("boom");
            }
            return new Paginator.Page<>(List.of("x"), "next");
        };

        assertThatThrownBy(() -> Paginator.collect(failing, 5))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
        assertThat(requested).containsExactly("", "next");
    }

    @Test
    void pagesNeededRoundsUp() {
        assertThat(Paginator.pagesNeeded(0, 50)).isZero();
        assertThat(Paginator.pagesNeeded(1, 50)).isEqualTo(1);
        assertThat(Paginator.pagesNeeded(50, 50)).isEqualTo(1);
        assertThat(Paginator.pagesNeeded(51, 50)).isEqualTo(2);
        assertThat(Paginator.pagesNeeded(120, 50)).isEqualTo(3);
    }

    @Test
    void pagesNeededDoesNotOverflowForLargeCounts() {
        assertThat(Paginator.pagesNeeded(Integer.MAX_VALUE, 50)).isEqualTo(42949673);
        assertThat(Paginator.pagesNeeded(Integer.MAX_VALUE - 47, 50)).isEqualTo(42949672);
    }

    private static final class ScriptedPages implements Paginator.PageFetcher<String> {

        private final List<String> requestedTokens = new ArrayList<>();

        @Override
        public Paginator.Page<String> fetch(String pageToken) {
            requestedTokens.add(pageToken);
            return switch (pageToken) {
                case "" -> new Paginator.Page<>(List.of("a1", "a2"), "page-2");
                case "page-2" -> new Paginator.Page<>(List.of("b1"), "page-3");
                case "page-3" -> new Paginator.Page<>(List.of("c1", "c2", "c3"), "");
                default -> throw new IllegalArgumentException("Unexpected token " + pageToken);
            };
        }
    }
}
