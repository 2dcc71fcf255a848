package com.webtomd.core.service.export;

import com.webtomd.core.model.AssembledDocument;
import com.webtomd.core.model.AssembledDocument.Section;

import java.util.ArrayList;
import java.util.List;

/** 배너 + 목차 + 섹션 조립. 섹션 순서 = 페이지 테이블 순서. */
public class DocumentAssembler {

    static final String TOC_HEADING = "# Contents\n";

    public AssembledDocument assemble(String baseUrl, List<Section> sections) {
        return new AssembledDocument(banner(baseUrl), tableOfContents(sections), sections);
    }

    static String banner(String baseUrl) {
        return "> **Main link: [" + baseUrl + "](" + baseUrl + ")**\n\n";
    }

    static String tableOfContents(List<Section> sections) {
        List<String> lines = new ArrayList<>();
        lines.add(TOC_HEADING);
        if (sections != null) {
            for (Section s : sections) {
                lines.add("- [" + s.title() + "](#" + s.anchorSlug() + ")");
            }
        }
        return String.join("\n", lines) + AssembledDocument.SEPARATOR;
    }
}
