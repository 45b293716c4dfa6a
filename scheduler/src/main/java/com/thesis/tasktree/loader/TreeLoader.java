package com.thesis.tasktree.loader;

import com.thesis.tasktree.exception.InvalidConfigurationException;
import com.thesis.tasktree.exception.MalformedTreeException;
import com.thesis.tasktree.exception.TaskTreeException;
import com.thesis.tasktree.exception.TreeParseException;
import com.thesis.tasktree.model.Task;
import com.thesis.tasktree.model.TaskTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link TaskTree} from a line-oriented edge list.
 * 
 * Input format:
 * <pre>
 * # procs=2
 * A_5 -> B_3
 * A_5 -> C_2
 * </pre>
 * 
 * - A line containing {@code #} sets the processor count. The canonical form
 *   is {@code # procs=N}; {@code # Proc N} is accepted as well. The last
 *   directive wins; without one the count is 1.
 * - A line containing {@code ->} is an edge {@code Parent -> Child} between
 *   two {@code Name_Duration} tokens. The first {@code _} separates the name
 *   from the duration.
 * - Every other line is ignored.
 * 
 * Loading fails fast: the first bad line aborts and no partial tree is returned.
 */
public class TreeLoader {
    
    private static final Logger LOG = LoggerFactory.getLogger(TreeLoader.class);
    
    public static final int DEFAULT_PROCESSOR_COUNT = 1;
    
    private static final String PROCESSOR_MARKER = "#";
    private static final String EDGE_MARKER = "->";
    private static final Pattern PROCESSOR_DIRECTIVE =
        Pattern.compile("^#\\s*procs?\\s*(?:=\\s*|\\s+)([+-]?\\d+)\\s*$", Pattern.CASE_INSENSITIVE);
    
    /**
     * Load a tree from a file. The path is used as the tree's source.
     */
    public TaskTree load(Path file) throws IOException, TaskTreeException {
        LOG.info("[TreeLoader] Loading task tree from {}", file);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(file.toString(), reader);
        }
    }
    
    /**
     * Load a tree from in-memory text.
     */
    public TaskTree parse(String source, String content) throws TaskTreeException {
        try {
            return load(source, new StringReader(content));
        } catch (IOException e) {
            // StringReader does not fail
            throw new IllegalStateException(e);
        }
    }
    
    public TaskTree load(String source, Reader input) throws IOException, TaskTreeException {
        BufferedReader reader = input instanceof BufferedReader
            ? (BufferedReader) input
            : new BufferedReader(input);
        
        Map<String, Task> nodes = new LinkedHashMap<>();
        Set<String> parents = new LinkedHashSet<>();
        Set<String> children = new LinkedHashSet<>();
        int processorCount = DEFAULT_PROCESSOR_COUNT;
        int edgeCount = 0;
        
        String raw;
        int lineNumber = 0;
        while ((raw = reader.readLine()) != null) {
            lineNumber++;
            String line = raw.trim();
            
            if (line.contains(PROCESSOR_MARKER)) {
                processorCount = parseProcessorCount(lineNumber, line);
            } else if (line.contains(EDGE_MARKER)) {
                String[] sides = line.split(EDGE_MARKER, -1);
                if (sides.length != 2) {
                    throw new TreeParseException(lineNumber, line,
                        "expected exactly one '" + EDGE_MARKER + "' between two tokens");
                }
                String parentToken = sides[0].trim();
                String childToken = sides[1].trim();
                
                Task parent = nodes.get(parentToken);
                if (parent == null) {
                    parent = parseTask(lineNumber, line, parentToken);
                    nodes.put(parentToken, parent);
                }
                Task child = nodes.get(childToken);
                if (child == null) {
                    child = parseTask(lineNumber, line, childToken);
                    nodes.put(childToken, child);
                }
                
                attach(lineNumber, parent, child, parentToken, childToken);
                parents.add(parentToken);
                children.add(childToken);
                edgeCount++;
                LOG.debug("[TreeLoader] Edge {} -> {}", parentToken, childToken);
            }
        }
        
        if (edgeCount == 0) {
            throw new MalformedTreeException("No dependency edges found in " + source);
        }
        
        Task root = nodes.get(findRootToken(parents, children));
        int reachable = TaskTree.preOrder(root).size();
        if (reachable != nodes.size()) {
            throw new MalformedTreeException(String.format(
                "%d of %d tasks are not reachable from root %s (cycle in the input)",
                nodes.size() - reachable, nodes.size(), root.getToken()));
        }
        
        LOG.info("[TreeLoader] Loaded {} tasks ({} edges), root={}, processors={}",
            nodes.size(), edgeCount, root, processorCount);
        return new TaskTree(source, root, processorCount, nodes);
    }
    
    /**
     * Parse a "Name_Duration" token.
     */
    static Task parseTask(int lineNumber, String line, String token) throws TreeParseException {
        int separator = token.indexOf('_');
        if (separator <= 0 || separator == token.length() - 1) {
            throw new TreeParseException(lineNumber, line,
                "token '" + token + "' is not of the form Name_Duration");
        }
        String name = token.substring(0, separator);
        String durationText = token.substring(separator + 1);
        
        int duration;
        try {
            duration = Integer.parseInt(durationText);
        } catch (NumberFormatException e) {
            throw new TreeParseException(lineNumber, line,
                "duration '" + durationText + "' of token '" + token + "' is not an integer", e);
        }
        if (duration < 0) {
            throw new TreeParseException(lineNumber, line,
                "duration of token '" + token + "' is negative");
        }
        return new Task(name, duration);
    }
    
    private int parseProcessorCount(int lineNumber, String line) throws TaskTreeException {
        String directive = line.substring(line.indexOf(PROCESSOR_MARKER));
        Matcher matcher = PROCESSOR_DIRECTIVE.matcher(directive);
        if (!matcher.matches()) {
            throw new TreeParseException(lineNumber, line,
                "processor directive must look like '# procs=<count>'");
        }
        
        int count;
        try {
            count = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new TreeParseException(lineNumber, line, "processor count is out of range", e);
        }
        if (count < 1) {
            throw new InvalidConfigurationException(String.format(
                "line %d: processor count must be >= 1, got %d", lineNumber, count));
        }
        LOG.debug("[TreeLoader] Processor count set to {} at line {}", count, lineNumber);
        return count;
    }
    
    private void attach(int lineNumber, Task parent, Task child, String parentToken, String childToken)
            throws MalformedTreeException {
        if (parent == child) {
            throw new MalformedTreeException(String.format(
                "line %d: task %s depends on itself", lineNumber, parentToken));
        }
        Task existing = child.getParent();
        if (existing == parent) {
            throw new MalformedTreeException(String.format(
                "line %d: duplicate edge %s -> %s", lineNumber, parentToken, childToken));
        }
        if (existing != null) {
            throw new MalformedTreeException(String.format(
                "line %d: task %s already depends on %s, a task may have only one parent",
                lineNumber, childToken, existing.getToken()));
        }
        parent.addChild(child);
    }
    
    /**
     * The root is the only token that is a parent but never a child.
     */
    private String findRootToken(Set<String> parents, Set<String> children) throws MalformedTreeException {
        Set<String> candidates = new LinkedHashSet<>(parents);
        candidates.removeAll(children);
        
        if (candidates.isEmpty()) {
            throw new MalformedTreeException("No root found: every parent is also a child (cycle in the input)");
        }
        if (candidates.size() > 1) {
            throw new MalformedTreeException("Ambiguous root, candidates: " + candidates);
        }
        return candidates.iterator().next();
    }
}
