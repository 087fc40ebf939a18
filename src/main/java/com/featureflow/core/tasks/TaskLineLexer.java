package com.featureflow.core.tasks;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one line of a tasks artifact into tokens.
 * <p>
 * Grammar (leading markers may come in any order, each at most once):
 * <pre>
 *   line      := indent bullet ' '+ checkbox (' '+ marker)* (' '+ text)?
 *   bullet    := '-' | '*'
 *   checkbox  := '[ ]' | '[x]' | '[X]'
 *   marker    := identifier | '[P]' | '[US' digits ']'
 *   identifier:= 'T' digits | '[T' digits ']'
 * </pre>
 * Lines that do not start with a bullet and checkbox yield no tokens.
 */
public final class TaskLineLexer {

    private static final Pattern CHECKBOX_LINE = Pattern.compile("^\\s*[-*]\\s+\\[([ xX])\\](?:\\s+(.*))?$");
    private static final Pattern IDENTIFIER = Pattern.compile("^\\[?(T\\d+)\\]?(?=\\s|$)");
    private static final Pattern PARALLEL = Pattern.compile("^\\[P\\](?=\\s|$)");
    private static final Pattern STORY = Pattern.compile("^\\[(US\\d+)\\](?=\\s|$)");

    private TaskLineLexer() {}

    public static List<TaskToken> tokenize(String line) {
        Matcher checkbox = CHECKBOX_LINE.matcher(line);
        if (!checkbox.matches()) {
            return List.of();
        }
        var tokens = new ArrayList<TaskToken>();
        tokens.add(new TaskToken(TaskTokenType.CHECKBOX, checkbox.group(1)));

        String rest = checkbox.group(2) == null ? "" : checkbox.group(2).strip();
        Set<TaskTokenType> seen = EnumSet.noneOf(TaskTokenType.class);
        boolean matched = true;
        while (matched && !rest.isEmpty()) {
            matched = false;
            Matcher m;
            if (!seen.contains(TaskTokenType.IDENTIFIER) && (m = IDENTIFIER.matcher(rest)).find()
                    && balanced(m.group())) {
                tokens.add(new TaskToken(TaskTokenType.IDENTIFIER, m.group(1)));
                seen.add(TaskTokenType.IDENTIFIER);
                rest = rest.substring(m.end()).strip();
                matched = true;
            } else if (!seen.contains(TaskTokenType.PARALLEL_MARKER) && (m = PARALLEL.matcher(rest)).find()) {
                tokens.add(new TaskToken(TaskTokenType.PARALLEL_MARKER, "P"));
                seen.add(TaskTokenType.PARALLEL_MARKER);
                rest = rest.substring(m.end()).strip();
                matched = true;
            } else if (!seen.contains(TaskTokenType.STORY_MARKER) && (m = STORY.matcher(rest)).find()) {
                tokens.add(new TaskToken(TaskTokenType.STORY_MARKER, m.group(1)));
                seen.add(TaskTokenType.STORY_MARKER);
                rest = rest.substring(m.end()).strip();
                matched = true;
            }
        }
        if (!rest.isEmpty()) {
            tokens.add(new TaskToken(TaskTokenType.TEXT, rest));
        }
        return tokens;
    }

    // "T001" and "[T001]" are identifiers, "[T001" and "T001]" are not
    private static boolean balanced(String token) {
        return token.startsWith("[") == token.endsWith("]");
    }
}
