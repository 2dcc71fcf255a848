package com.webtomd.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PageTableTest {

    private static PageRecord page(String url, String title) {
        return new PageRecord(url, "<p/>", title, title.toLowerCase());
    }

    @Test
    void keepsInsertionOrderAndRejectsDuplicates() {
        PageTable t = new PageTable();
        t.add(page("https://ex.com/", "home"));
        t.add(page("https://ex.com/b", "b"));
        t.add(page("https://ex.com/a", "a"));

        assertThat(t.urls()).containsExactly("https://ex.com/", "https://ex.com/b", "https://ex.com/a");
        assertThatThrownBy(() -> t.add(page("https://ex.com/a", "again")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void findByLinkIgnoresTrailingSlashes() {
        PageTable t = new PageTable();
        t.add(page("https://ex.com/docs/", "docs"));

        assertThat(t.findByLink("https://ex.com/docs")).map(PageRecord::title).contains("docs");
        assertThat(t.findByLink("https://ex.com/docs/")).map(PageRecord::title).contains("docs");
        assertThat(t.findByLink("https://ex.com/doc")).isEmpty();
    }

    @Test
    void firstMatchingPageWins() {
        PageTable t = new PageTable();
        t.add(page("https://ex.com/a/", "first"));
        t.add(page("https://ex.com/a", "second"));

        assertThat(t.findByLink("https://ex.com/a")).map(PageRecord::title).contains("first");
    }
}
