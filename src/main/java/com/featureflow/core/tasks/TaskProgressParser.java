package com.featureflow.core.tasks;

import com.featureflow.core.model.TaskItem;
import com.featureflow.core.model.TaskProgress;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads task items out of a tasks artifact and aggregates their completion.
 * <p>
 * Order is document order; the parallel marker is carried as a hint only.
 */
@Service
public class TaskProgressParser {

    public List<TaskItem> parse(String text) {
        var items = new ArrayList<TaskItem>();
        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            List<TaskToken> tokens = TaskLineLexer.tokenize(lines[i]);
            if (!tokens.isEmpty()) {
                items.add(toItem(tokens, items.size() + 1, i + 1));
            }
        }
        return items;
    }

    /** Parses the file, or returns an empty list when it does not exist. */
    public List<TaskItem> parse(Path tasksFile) {
        if (!Files.isRegularFile(tasksFile)) {
            return List.of();
        }
        try {
            return parse(Files.readString(tasksFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + tasksFile, e);
        }
    }

    public TaskProgress computeProgress(List<TaskItem> items) {
        if (items.isEmpty()) {
            return TaskProgress.EMPTY;
        }
        int completed = 0;
        TaskItem nextPending = null;
        for (TaskItem item : items) {
            if (item.completed()) {
                completed++;
            } else if (nextPending == null) {
                nextPending = item;
            }
        }
        return new TaskProgress(completed, items.size(), completed * 100 / items.size(), nextPending);
    }

    private static TaskItem toItem(List<TaskToken> tokens, int ordinal, int lineNumber) {
        boolean completed = false;
        boolean parallel = false;
        String id = null;
        String story = null;
        String text = "";
        for (TaskToken token : tokens) {
            switch (token.type()) {
                case CHECKBOX -> completed = token.isCompletedCheckbox();
                case IDENTIFIER -> id = token.value();
                case PARALLEL_MARKER -> parallel = true;
                case STORY_MARKER -> story = token.value();
                case TEXT -> text = token.value();
            }
        }
        if (id == null) {
            id = String.format("TASK-%03d", ordinal);
        }
        return new TaskItem(id, text, completed, parallel, story, lineNumber);
    }
}
