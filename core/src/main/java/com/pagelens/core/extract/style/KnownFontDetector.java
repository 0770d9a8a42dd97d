package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.FontRef;

import java.util.ArrayList;
import java.util.List;

/** 직렬화 마크업 어딘가에 이름이 등장하는 잘 알려진 폰트 */
public final class KnownFontDetector implements FontDetector {
    static final String SOURCE = "Detected in HTML";

    static final List<String> COMMON_FONTS = List.of(
            "Arial", "Helvetica", "Times New Roman", "Courier New", "Verdana", "Georgia",
            "Palatino", "Garamond", "Bookman", "Comic Sans", "Trebuchet", "Impact",
            "Roboto", "Open Sans", "Lato", "Montserrat", "Oswald", "Raleway", "Ubuntu",
            "Playfair Display", "Merriweather", "Poppins", "Source Sans Pro", "Nunito");

    @Override
    public List<FontRef> detect(PageContext ctx) {
        String html = ctx.markup();
        List<FontRef> out = new ArrayList<>();
        for (String name : COMMON_FONTS) {
            if (html.contains(name)) out.add(FontRef.of(name, SOURCE));
        }
        return out;
    }
}
