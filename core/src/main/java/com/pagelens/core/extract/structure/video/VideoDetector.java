package com.pagelens.core.extract.structure.video;

import com.pagelens.core.extract.PageContext;
import com.pagelens.core.model.VideoRef;

import java.util.List;

/** 비디오 후보 탐지기. 결과 병합/중복 제거는 VideoExtractor가 한 번에 처리 */
public interface VideoDetector {
    List<VideoRef> detect(PageContext ctx);
}
