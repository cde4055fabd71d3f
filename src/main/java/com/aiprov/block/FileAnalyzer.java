package com.aiprov.block;

import java.util.List;

import com.aiprov.model.Block;
import com.aiprov.model.FileRecord;
import com.aiprov.model.Tag;
import com.aiprov.tag.CommentStyle;
import com.aiprov.tag.TagOccurrence;
import com.aiprov.tag.TagParser;
import com.aiprov.tag.TagScan;
import com.aiprov.tag.TextLines;

public class FileAnalyzer {
    private final TagParser tagParser;
    private final BlockResolver blockResolver;

    public FileAnalyzer() {
        this(new TagParser(), new BlockResolver());
    }

    public FileAnalyzer(TagParser tagParser, BlockResolver blockResolver) {
        this.tagParser = tagParser;
        this.blockResolver = blockResolver;
    }

    public FileAnalysis analyze(String path, String revision, String text) throws BlockResolutionException {
        CommentStyle style = tagParser.registry().styleFor(path);
        List<String> lines = TextLines.split(text);
        TagScan scan = tagParser.scan(path, text);
        List<Block> blocks = blockResolver.resolve(path, lines, scan, style);
        int fileLevelLine = blockResolver.fileLevelTagLine(lines, scan.tags(), style);
        Tag fileTag = null;
        if (fileLevelLine > 0) {
            fileTag = scan.tags().stream()
                    .filter(occurrence -> occurrence.lineNumber() == fileLevelLine)
                    .map(TagOccurrence::tag)
                    .findFirst()
                    .orElse(null);
        }
        return new FileAnalysis(new FileRecord(path, revision, blocks, fileTag), scan);
    }
}
