package com.legalrag.agent.answer;

import com.legalrag.agent.model.ResultItem;

import java.util.List;
import java.util.Map;

/**
 * Renders tagged results into the numbered context block of the answer prompt.
 * Each block carries whatever citation fields the item has (article, title,
 * clause for internal passages; url for web pages) so the model can cite them.
 */
final class ContextFormatter {

    private ContextFormatter() {
    }

    static String format(List<ResultItem> items) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            ResultItem item = items.get(i);
            Map<String, Object> metadata = item.getMetadata() != null ? item.getMetadata() : Map.of();
            String label = item.getSourceType() == ResultItem.SourceType.WEB ? "web" : "internal";

            if (i > 0) sb.append('\n');
            sb.append("[Source ").append(i + 1).append(" - ").append(label).append("]\n");
            appendIfPresent(sb, "Article", metadata.get("article_id"));
            appendIfPresent(sb, "Title", metadata.get("article_title"));
            appendIfPresent(sb, "Clause", metadata.get("clause_id"));
            appendIfPresent(sb, "URL", metadata.get("url"));
            sb.append("Content: ").append(item.getText()).append('\n');
        }
        return sb.toString();
    }

    private static void appendIfPresent(StringBuilder sb, String label, Object value) {
        if (value != null && !value.toString().isBlank()) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }
}
