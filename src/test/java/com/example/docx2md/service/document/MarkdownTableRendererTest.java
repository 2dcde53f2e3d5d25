package com.example.docx2md.service.document;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownTableRendererTest {

    private final MarkdownTableRenderer renderer = new MarkdownTableRenderer();

    @Test
    void firstRowIsHeader() {
        String table = renderer.render(List.of(
                List.of("Name", "Value"),
                List.of("x", "1|2")));

        assertThat(table).isEqualTo(
                "| Name | Value |\n"
                        + "|------|-------|\n"
                        + "| x    | 1\\|2  |");
    }

    @Test
    void narrowColumnsArePaddedToThree() {
        String table = renderer.render(List.of(List.of("a"), List.of("b")));

        assertThat(table).isEqualTo("| a   |\n|-----|\n| b   |");
    }

    @Test
    void shortRowsAndBlankCellsArePadded() {
        String table = renderer.render(List.of(
                List.of("h1", "h2"),
                List.of("only"),
                Arrays.asList("  spaced\n out ", null)));

        assertThat(table.split("\n")).containsExactly(
                "| h1         | h2  |",
                "|------------|-----|",
                "| only       |     |",
                "| spaced out |     |");
    }

    @Test
    void emptyInputRendersNothing() {
        assertThat(renderer.render(List.of())).isEmpty();
        assertThat(renderer.render(null)).isEmpty();
    }
}
