package com.pagelens.core.extract.style;

import com.pagelens.core.extract.PageContext;

import java.util.List;

public interface ColorSource {
    List<ColorSample> collect(PageContext ctx);
}
