package com.example.sqlsplitter.service.sql.split;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter + trim sau lượt duyệt. Thứ tự cố định: bỏ statement rỗng (trên text chưa trim),
 * cắt terminator, rồi mới trim whitespace.
 */
public class StatementPostProcessor {

    public SplitResult apply(List<RawStatement> raw, SplitOptions options) {
        List<String> statements = new ArrayList<>(raw.size());
        List<Integer> placeholders = new ArrayList<>(raw.size());

        for (RawStatement r : raw) {
            if (!options.isKeepEmptyStatements() && isEmpty(r.getText())) continue;

            String text = options.isKeepTerminator() ? r.getText() : trimTerminator(r);
            if (!options.isKeepExtraSpaces()) text = text.strip();

            statements.add(text);
            placeholders.add(r.getPlaceholders());
        }
        return new SplitResult(statements, placeholders);
    }

    /** Rỗng = không có ký tự nào ngoài whitespace, ';' và '/'. Comment không bao giờ rỗng. */
    static boolean isEmpty(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c) && c != ';' && c != '/') return false;
        }
        return true;
    }

    static String trimTerminator(RawStatement r) {
        String text = r.getText();
        if (!r.hasTerminator()) return text;

        String head = text.substring(0, r.getTerminatorStart());
        String tail = text.substring(r.getTerminatorEnd());

        int folded = r.getFoldedTerminatorStart();
        if (folded >= 0) {
            String between = head.substring(folded + 1);
            head = head.substring(0, folded) + (between.isBlank() ? "" : between);
        }
        return head + tail;
    }
}
