package com.webtomd.core.crawler;

import com.webtomd.core.model.CrawlConfig;
import com.webtomd.core.model.SelectorType;

import java.util.List;

/** 가져온 모든 페이지에 한 번 적용하는 사전 제거. 설정이 없으면 항등 변환. */
public final class PreRemovalStep {
    private final SelectorType type;
    private final List<String> values;

    public PreRemovalStep(SelectorType type, List<String> values) {
        this.type = type;
        this.values = (values == null) ? List.of() : List.copyOf(values);
    }

    public static PreRemovalStep from(CrawlConfig config) {
        if (!config.isPreRemovalEnabled()) return new PreRemovalStep(null, List.of());
        return new PreRemovalStep(config.getPreRemoveType(), config.preRemoveValues());
    }

    public boolean isEnabled() { return type != null && !values.isEmpty(); }

    public String apply(String html) {
        if (!isEnabled()) return html;
        return ElementStripper.strip(html, type, values);
    }
}
