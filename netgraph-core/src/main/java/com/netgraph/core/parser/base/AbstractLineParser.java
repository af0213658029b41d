package com.netgraph.core.parser.base;

import com.netgraph.core.error.ErrorKind;
import com.netgraph.core.error.NetlistException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for the line-oriented netlist passes.
 *
 * <p>Both passes read the whole source into memory as a line sequence and scan it
 * forward once. This class provides:
 * <ul>
 *   <li>Logger initialization (one logger per concrete pass)</li>
 *   <li>Source loading ({@link #readLines(Path)}, {@link #toLines(String)})</li>
 *   <li>Regex matching utilities returning detached {@link MatchResult}s</li>
 *   <li>The blank/comment line filter shared by every pass</li>
 * </ul>
 *
 * @see com.netgraph.core.parser.TemplateExtractor
 * @see com.netgraph.core.parser.NetlistParser
 */
public abstract class AbstractLineParser {

    /**
     * Logger instance for this pass.
     * Automatically initialized with the concrete class name.
     */
    protected final Logger log;

    /**
     * Constructor that initializes the logger for the concrete pass.
     */
    protected AbstractLineParser() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Source Loading ====================

    /**
     * Reads all lines of a netlist source file.
     *
     * @param file path to the source file
     * @return lines without terminators
     * @throws NetlistException with {@link ErrorKind#IO_ERROR} if the file is missing or unreadable
     */
    protected List<String> readLines(Path file) throws NetlistException {
        Objects.requireNonNull(file, "file must not be null");
        if (!Files.isRegularFile(file)) {
            log.error("The file at {} was not found", file);
            throw new NetlistException(ErrorKind.IO_ERROR, "The file at " + file + " was not found");
        }
        try {
            return Files.readAllLines(file);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            throw new NetlistException(ErrorKind.IO_ERROR, "Failed to read " + file, e);
        }
    }

    /**
     * Splits in-memory source text into lines.
     *
     * @param source source text
     * @return lines without terminators
     */
    protected static List<String> toLines(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return source.lines().toList();
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return one detached result per match, in order
     */
    protected List<MatchResult> findAll(Pattern pattern, String text) {
        List<MatchResult> results = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            results.add(matcher.toMatchResult());
        }
        return results;
    }

    /**
     * Counts the matches of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return number of matches
     */
    protected int count(Pattern pattern, String text) {
        int count = 0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matcher positioned on the match, or null if none
     */
    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    // ==================== Line Filtering ====================

    /**
     * Checks if a line carries no structure: blank, or a {@code //} comment.
     *
     * @param line source line
     * @return true if the line is skipped by every pass
     */
    protected boolean isSkippable(String line) {
        if (line == null) {
            return true;
        }
        String trimmed = line.trim();
        return trimmed.isEmpty() || trimmed.startsWith("//");
    }
}
