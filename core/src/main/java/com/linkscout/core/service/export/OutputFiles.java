package com.linkscout.core.service.export;

import java.nio.file.Path;

/** 출력 파일 이름 규칙(출력 디렉터리 기준). */
public final class OutputFiles {
    private OutputFiles() {}

    public static final String LINK_TREE_JSON = "link_tree.json";
    public static final String UNIQUE_LINKS_CSV = "unique_links.csv";
    public static final String BROKEN_LINKS_CSV = "broken_links_output.csv";

    public static Path linkTree(Path outDir) { return outDir.resolve(LINK_TREE_JSON); }
    public static Path uniqueLinks(Path outDir) { return outDir.resolve(UNIQUE_LINKS_CSV); }
    public static Path brokenLinks(Path outDir) { return outDir.resolve(BROKEN_LINKS_CSV); }
}
