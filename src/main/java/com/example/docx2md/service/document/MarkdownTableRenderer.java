package com.example.docx2md.service.document;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders table cell text as a Markdown pipe table. The first row is the header;
 * columns are padded to the widest cell, at least three characters.
 */
@Component
public class MarkdownTableRenderer {

    private static final int MIN_COLUMN_WIDTH = 3;

    public String render(List<List<String>> rows) {
        if (rows == null || rows.isEmpty() || rows.get(0).isEmpty()) {
            return "";
        }

        List<String> header = rows.get(0);
        int columns = header.size();
        int[] widths = new int[columns];
        for (int i = 0; i < columns; i++) {
            widths[i] = Math.max(cellText(header.get(i)).length(), MIN_COLUMN_WIDTH);
        }
        for (List<String> row : rows.subList(1, rows.size())) {
            for (int i = 0; i < row.size() && i < columns; i++) {
                widths[i] = Math.max(widths[i], cellText(row.get(i)).length());
            }
        }

        List<String> lines = new ArrayList<>();
        lines.add(formatRow(header, widths));

        StringBuilder separator = new StringBuilder("|");
        for (int width : widths) {
            separator.append(StringUtils.repeat('-', width + 2)).append('|');
        }
        lines.add(separator.toString());

        for (List<String> row : rows.subList(1, rows.size())) {
            lines.add(formatRow(row, widths));
        }
        return String.join("\n", lines);
    }

    private String formatRow(List<String> row, int[] widths) {
        List<String> cells = new ArrayList<>();
        for (int i = 0; i < widths.length; i++) {
            String text = i < row.size() ? cellText(row.get(i)) : " ";
            cells.add(StringUtils.rightPad(text, widths[i]));
        }
        return "| " + String.join(" | ", cells) + " |";
    }

    private String cellText(String text) {
        String normalized = StringUtils.normalizeSpace(text);
        if (StringUtils.isEmpty(normalized)) {
            return " ";
        }
        return normalized.replace("|", "\\|");
    }
}
