package com.storycast.processing.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Normalized paragraphs of a document together with the page each paragraph came from.
 *
 * <p>{@code pageBoundaries[i]} is the index of the first paragraph contributed by page {@code i};
 * the trailing entry equals the paragraph count. A page that contributed no paragraph shares its
 * boundary with the next page.</p>
 */
public class ParagraphLayout {
    private final List<String> paragraphs;
    private final int[] pageBoundaries;

    public ParagraphLayout(List<String> paragraphs, int[] pageBoundaries) {
        this.paragraphs = Collections.unmodifiableList(paragraphs);
        this.pageBoundaries = pageBoundaries.clone();
    }

    public List<String> getParagraphs() {
        return paragraphs;
    }

    public int[] getPageBoundaries() {
        return pageBoundaries.clone();
    }

    public int getPageCount() {
        return pageBoundaries.length - 1;
    }

    public boolean isEmpty() {
        return paragraphs.isEmpty();
    }

    @Override
    public String toString() {
        return "ParagraphLayout{paragraphs=" + paragraphs.size() + ", boundaries="
                + Arrays.toString(pageBoundaries) + "}";
    }

    /**
     * Inclusive, 0-based range of page indices.
     */
    public static class PageRange {
        private final int firstPage;
        private final int lastPage;

        public PageRange(int firstPage, int lastPage) {
            this.firstPage = firstPage;
            this.lastPage = lastPage;
        }

        public int getFirstPage() {
            return firstPage;
        }

        public int getLastPage() {
            return lastPage;
        }

        public int getPageCount() {
            return lastPage - firstPage + 1;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof PageRange)) {
                return false;
            }
            PageRange that = (PageRange) o;
            return firstPage == that.firstPage && lastPage == that.lastPage;
        }

        @Override
        public int hashCode() {
            return 31 * firstPage + lastPage;
        }

        @Override
        public String toString() {
            return firstPage + ".." + lastPage;
        }
    }
}
