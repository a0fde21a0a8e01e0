package com.eainde.forecast.extraction;

import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.List;

/**
 * Text stripper that keeps table columns apart. Words on a line separated by a gap wider than
 * {@link #COLUMN_GAP_IN_SPACES} space widths are joined with a tab instead of a space, so
 * positioned table cells come out as tab separated rows.
 */
class ColumnAwareTextStripper extends PDFTextStripper {

    static final float COLUMN_GAP_IN_SPACES = 2.5f;

    private boolean separatorPending;
    private float previousEnd = Float.NaN;
    private float previousSpaceWidth = Float.NaN;

    ColumnAwareTextStripper() throws IOException {
        setSortByPosition(true);
        setPageEnd("\f");
    }

    @Override
    protected void writeWordSeparator() {
        // decided once the next word's position is known
        separatorPending = true;
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (separatorPending) {
            output.write(isColumnGap(textPositions) ? "\t" : getWordSeparator());
            separatorPending = false;
        }
        super.writeString(text, textPositions);
        if (!textPositions.isEmpty()) {
            TextPosition last = textPositions.get(textPositions.size() - 1);
            previousEnd = last.getXDirAdj() + last.getWidthDirAdj();
            previousSpaceWidth = last.getWidthOfSpace();
        }
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        separatorPending = false;
        previousEnd = Float.NaN;
        super.writeLineSeparator();
    }

    private boolean isColumnGap(List<TextPosition> next) {
        if (next.isEmpty() || Float.isNaN(previousEnd)) {
            return false;
        }
        TextPosition first = next.get(0);
        float space = previousSpaceWidth > 0 && Float.isFinite(previousSpaceWidth)
                ? previousSpaceWidth
                : first.getWidthDirAdj();
        return first.getXDirAdj() - previousEnd > COLUMN_GAP_IN_SPACES * space;
    }
}
