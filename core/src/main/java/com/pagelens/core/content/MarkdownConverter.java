package com.pagelens.core.content;

import org.jsoup.nodes.Element;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 필터링된 본문 → Markdown.
 * 문서 순서가 아니라 종류별로 묶어서 출력한다: 제목 → 문단 → 목록 → 인용 → 코드 → 이미지.
 * 구조 요소가 하나도 없으면 전체 텍스트.
 */
final class MarkdownConverter {

    private final boolean ignoreLinks;
    private final boolean textOnly;

    MarkdownConverter(boolean ignoreLinks, boolean textOnly) {
        this.ignoreLinks = ignoreLinks;
        this.textOnly = textOnly;
    }

    String convert(Element root) {
        StringBuilder md = new StringBuilder();

        for (Element h : root.select("h1, h2, h3, h4, h5, h6")) {
            String text = h.text().trim();
            if (text.isEmpty()) continue;
            int level = h.normalName().charAt(1) - '0';
            md.append("#".repeat(level)).append(' ').append(text).append("\n\n");
        }

        for (Element p : root.select("p")) {
            String text = paragraph(p);
            if (!text.isEmpty()) md.append(text).append("\n\n");
        }

        for (Element list : root.select("ul, ol")) {
            boolean ordered = list.normalName().equals("ol");
            int index = 0;
            for (Element li : list.select("li")) {
                index++;
                String text = li.text().trim();
                if (text.isEmpty()) continue;
                md.append(ordered ? index + ". " : "- ").append(text).append('\n');
            }
            md.append('\n');
        }

        for (Element q : root.select("blockquote")) {
            String text = q.text().trim();
            if (!text.isEmpty()) md.append("> ").append(text).append("\n\n");
        }

        for (Element pre : root.select("pre")) {
            String code = pre.wholeText().trim();
            if (!code.isEmpty()) md.append("```\n").append(code).append("\n```\n\n");
        }

        if (!textOnly) {
            for (Element img : root.select("img")) {
                String src = img.attr("src");
                if (!src.isEmpty()) {
                    md.append("![").append(img.attr("alt")).append("](").append(src).append(")\n\n");
                }
            }
        }

        if (md.toString().isBlank()) {
            return root.text();
        }
        return md.toString();
    }

    /** 문단 텍스트. 링크 텍스트의 첫 등장 위치를 [text](href)로 바꾼다 */
    private String paragraph(Element p) {
        String text = p.text().trim();
        if (ignoreLinks) return text;

        for (Element a : p.select("a")) {
            String href = a.attr("href");
            String linkText = a.text().trim();
            if (href.isEmpty() || linkText.isEmpty()) continue;
            text = text.replaceFirst(Pattern.quote(linkText),
                    Matcher.quoteReplacement("[" + linkText + "](" + href + ")"));
        }
        return text;
    }
}
