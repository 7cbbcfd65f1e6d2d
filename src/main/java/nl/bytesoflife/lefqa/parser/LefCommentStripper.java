package nl.bytesoflife.lefqa.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes {@code #} comments from LEF text ahead of parsing. Line numbering is preserved:
 * a comment-only line becomes blank rather than disappearing.
 */
public class LefCommentStripper {

    private static final Pattern COMMENT = Pattern.compile("\\s*#.*");

    public record Result(List<String> lines, List<String> comments) {
    }

    public Result strip(String content) {
        List<String> lines = new ArrayList<>();
        List<String> comments = new ArrayList<>();
        int lineNumber = 0;
        for (String line : content.lines().toList()) {
            lineNumber++;
            if (line.indexOf('#') >= 0) {
                comments.add("Line " + lineNumber + ": " + line);
                line = COMMENT.matcher(line).replaceAll("");
            }
            lines.add(line);
        }
        return new Result(lines, comments);
    }
}
