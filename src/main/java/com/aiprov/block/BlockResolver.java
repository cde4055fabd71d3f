package com.aiprov.block;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.aiprov.model.Block;
import com.aiprov.model.BlockKind;
import com.aiprov.model.Tag;
import com.aiprov.tag.CommentStyle;
import com.aiprov.tag.TagOccurrence;
import com.aiprov.tag.TagScan;

/**
 * Splits a file into blocks. A tag governs the lines from its own line to the
 * first of: the line before the next tag, an {@code ai:end} marker, or the end
 * of the file. This is a lexical heuristic; without a syntax tree the end of a
 * function or class is not known. Ungoverned ranges become untagged blocks, so
 * the result always covers every line exactly once.
 */
public class BlockResolver {
    private final BlockKindDetector kindDetector;

    public BlockResolver() {
        this(new BlockKindDetector());
    }

    public BlockResolver(BlockKindDetector kindDetector) {
        this.kindDetector = kindDetector;
    }

    public List<Block> resolve(String path, List<String> lines, TagScan scan, CommentStyle style) throws BlockResolutionException {
        int lineCount = lines.size();
        if (lineCount == 0) {
            return List.of();
        }

        List<TagOccurrence> tags = new ArrayList<>(scan.tags());
        tags.sort(Comparator.comparingInt(TagOccurrence::lineNumber));
        List<Integer> closingMarkers = new ArrayList<>(scan.closingMarkers());
        closingMarkers.sort(Comparator.naturalOrder());
        int fileLevelLine = fileLevelTagLine(lines, tags, style);

        List<Block> blocks = new ArrayList<>();
        int nextUngoverned = 1;
        for (int i = 0; i < tags.size(); i++) {
            TagOccurrence occurrence = tags.get(i);
            int start = occurrence.lineNumber();
            if (start > lineCount) {
                throw new BlockResolutionException(path, start, "tag beyond end of file (" + lineCount + " lines)");
            }
            int end = lineCount;
            if (i + 1 < tags.size()) {
                end = Math.min(end, tags.get(i + 1).lineNumber() - 1);
            }
            for (int marker : closingMarkers) {
                if (marker > start) {
                    end = Math.min(end, marker);
                    break;
                }
            }
            if (end < start) {
                throw new BlockResolutionException(path, start, "more than one tag on line " + start);
            }

            if (start > nextUngoverned) {
                blocks.add(untagged(lines, nextUngoverned, start - 1));
            }
            blocks.add(tagged(lines, start, end, occurrence.tag(), start == fileLevelLine, style));
            nextUngoverned = end + 1;
        }
        if (nextUngoverned <= lineCount) {
            blocks.add(untagged(lines, nextUngoverned, lineCount));
        }

        verifyCoverage(path, blocks, lineCount);
        return List.copyOf(blocks);
    }

    public int fileLevelTagLine(List<String> lines, List<TagOccurrence> tags, CommentStyle style) {
        if (tags.isEmpty()) {
            return -1;
        }
        int firstTagLine = tags.stream().mapToInt(TagOccurrence::lineNumber).min().getAsInt();
        for (int lineNumber = 1; lineNumber < firstTagLine && lineNumber <= lines.size(); lineNumber++) {
            String line = lines.get(lineNumber - 1);
            if (line.isBlank() || line.startsWith("#!") || style.isCommentLine(line)) {
                continue;
            }
            return -1;
        }
        return firstTagLine;
    }

    static void verifyCoverage(String path, List<Block> blocks, int lineCount) throws BlockResolutionException {
        int expectedStart = 1;
        for (Block block : blocks) {
            if (block.startLine() < expectedStart) {
                throw new BlockResolutionException(path, block.startLine(), "blocks overlap at line " + block.startLine());
            }
            if (block.startLine() > expectedStart) {
                throw new BlockResolutionException(path, expectedStart, "lines " + expectedStart + "-" + (block.startLine() - 1) + " are not covered");
            }
            expectedStart = block.endLine() + 1;
        }
        if (expectedStart != lineCount + 1) {
            throw new BlockResolutionException(path, Math.min(expectedStart, lineCount),
                    "blocks end at line " + (expectedStart - 1) + " but the file has " + lineCount + " lines");
        }
    }

    private Block tagged(List<String> lines, int start, int end, Tag tag, boolean fileLevel, CommentStyle style) {
        if (fileLevel) {
            return new Block(BlockKind.MODULE, null, start, end, countNonBlank(lines, start, end), tag);
        }
        Optional<BlockKindDetector.Declaration> declaration = kindDetector.detect(lines, start + 1, end, style);
        BlockKind kind = declaration.map(BlockKindDetector.Declaration::kind).orElse(BlockKind.GENERIC);
        String name = declaration.map(BlockKindDetector.Declaration::name).orElse(null);
        return new Block(kind, name, start, end, countNonBlank(lines, start, end), tag);
    }

    private static Block untagged(List<String> lines, int start, int end) {
        return Block.untagged(start, end, countNonBlank(lines, start, end));
    }

    private static int countNonBlank(List<String> lines, int start, int end) {
        int count = 0;
        for (int lineNumber = start; lineNumber <= end; lineNumber++) {
            if (!lines.get(lineNumber - 1).isBlank()) {
                count++;
            }
        }
        return count;
    }
}
