package com.dcruver.clippets.app;

import com.dcruver.clippets.config.ClippetsProperties;
import com.dcruver.clippets.domain.Element;
import com.dcruver.clippets.domain.Elements;
import com.dcruver.clippets.domain.Group;
import com.dcruver.clippets.domain.Root;
import com.dcruver.clippets.domain.Snippet;
import com.dcruver.clippets.io.SnippetSession;
import com.dcruver.clippets.pointer.CannotMoveException;
import com.dcruver.clippets.pointer.GroupInsertionPointer;
import com.dcruver.clippets.pointer.InsertionAddress;
import com.dcruver.clippets.pointer.InsertionPointer;
import com.dcruver.clippets.pointer.SnippetInsertionPointer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Spring Shell commands for viewing and editing a snippet file.
 * Elements are addressed by the IDs shown by {@code tree}.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class SnippetShellCommands {

    private final SnippetSession session;
    private final ClippetsProperties properties;

    @ShellMethod(key = "load", value = "Load a snippet file")
    public String load(@ShellOption(defaultValue = ShellOption.NULL) String file) {
        String target = file != null ? file : properties.getFile();
        if (target == null) {
            return "No file given and clippets.file is not set.";
        }
        try {
            Root root = session.load(Path.of(target));
            return String.format("Loaded %d groups from %s", root.totalGroupCount(), target);
        } catch (IOException e) {
            log.error("Load failed", e);
            return "Load failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "outline", value = "Show the group outline")
    public String outline() {
        try {
            StringBuilder sb = new StringBuilder();
            for (Element el : root().walk(Elements::isGroup)) {
                Group group = (Group) el;
                sb.append("  ".repeat(group.depth() - 1)).append(group.getName());
                if (!group.getTags().isEmpty()) {
                    sb.append(" [").append(String.join(" ", group.getTags())).append("]");
                }
                sb.append(" (").append(group.snippets().size()).append(")\n");
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Outline failed", e);
            return "Outline failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "tree", value = "Show the whole tree with element IDs")
    public String tree() {
        try {
            return root().fullRepr(true);
        } catch (Exception e) {
            log.error("Tree failed", e);
            return "Tree failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "show", value = "Show the text of a snippet")
    public String show(@ShellOption String id) {
        try {
            return findSnippet(id).getBody();
        } catch (Exception e) {
            log.error("Show failed", e);
            return "Show failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "find", value = "List snippets containing some text")
    public String find(@ShellOption String text) {
        try {
            String wanted = text.toLowerCase(Locale.ROOT);
            StringBuilder sb = new StringBuilder();
            for (Element el : root().walk(Elements::isSnippet)) {
                Snippet snippet = (Snippet) el;
                String body = snippet.getBody();
                if (body.toLowerCase(Locale.ROOT).contains(wanted)) {
                    String firstLine = body.lines().findFirst().orElse("");
                    sb.append(String.format("%-12s %s: %s%n",
                        snippet.getUid(), snippet.getParent().fullName(), firstLine));
                }
            }
            return sb.length() == 0 ? "No matching snippets." : sb.toString();
        } catch (Exception e) {
            log.error("Find failed", e);
            return "Find failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "add snippet", value = "Add a Markdown snippet at the start of a group")
    public String addSnippet(@ShellOption String group, @ShellOption String text) {
        try {
            if (text.isBlank()) {
                return "A snippet needs some text.";
            }
            Group target = findGroup(group);
            Snippet snippet = target.addNew();
            snippet.setText(text.replace("\\n", "\n"));
            target.clean();
            return "Added " + snippet.getUid() + " to " + target.fullName();
        } catch (Exception e) {
            log.error("Add snippet failed", e);
            return "Add snippet failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "add group", value = "Add a group, optionally with [tags]")
    public String addGroup(@ShellOption String name,
                           @ShellOption(defaultValue = ShellOption.NULL) String parent) {
        try {
            Group target = parent == null ? root() : findGroup(parent);
            Group group = target.addGroup(name);
            target.clean();
            return "Group " + group.getUid() + ": " + group.fullName();
        } catch (Exception e) {
            log.error("Add group failed", e);
            return "Add group failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "set-text", value = "Replace the text of a snippet")
    public String setText(@ShellOption String id, @ShellOption String text) {
        try {
            Snippet snippet = findSnippet(id);
            snippet.setText(text.replace("\\n", "\n"));
            snippet.getParent().clean();
            return "Updated " + id;
        } catch (Exception e) {
            log.error("Set text failed", e);
            return "Set text failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "duplicate", value = "Duplicate a snippet")
    public String duplicate(@ShellOption String id) {
        try {
            Snippet copy = findSnippet(id).duplicate();
            return "Created " + copy.getUid();
        } catch (Exception e) {
            log.error("Duplicate failed", e);
            return "Duplicate failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "remove", value = "Remove a snippet")
    public String remove(@ShellOption String id) {
        try {
            Snippet snippet = findSnippet(id);
            Group parent = snippet.getParent();
            parent.remove(snippet);
            parent.clean();
            return "Removed " + id;
        } catch (Exception e) {
            log.error("Remove failed", e);
            return "Remove failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "rename group", value = "Rename a group")
    public String renameGroup(@ShellOption String id, @ShellOption String name) {
        try {
            Group group = findGroup(id);
            group.rename(name);
            return "Renamed to " + group.fullName();
        } catch (Exception e) {
            log.error("Rename failed", e);
            return "Rename failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "move snippet", value = "Move a snippet; negative steps move it up")
    public String moveSnippet(@ShellOption String id, @ShellOption(defaultValue = "-1") int steps) {
        try {
            Snippet snippet = findSnippet(id);
            return move(new SnippetInsertionPointer(snippet), steps);
        } catch (CannotMoveException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Move snippet failed", e);
            return "Move snippet failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "move group", value = "Move a group; negative steps move it up")
    public String moveGroup(@ShellOption String id, @ShellOption(defaultValue = "-1") int steps) {
        try {
            Group group = findGroup(id);
            return move(new GroupInsertionPointer(group), steps);
        } catch (CannotMoveException e) {
            return e.getMessage();
        } catch (Exception e) {
            log.error("Move group failed", e);
            return "Move group failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "diff", value = "Show unsaved changes")
    public String diff() {
        try {
            String diff = session.diff();
            return diff.isEmpty() ? "No changes." : diff;
        } catch (Exception e) {
            log.error("Diff failed", e);
            return "Diff failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "save", value = "Save the snippet file, keeping numbered backups")
    public String save() {
        try {
            session.save();
            return "Saved " + session.getPath();
        } catch (Exception e) {
            log.error("Save failed", e);
            return "Save failed: " + e.getMessage();
        }
    }

    private String move(InsertionPointer<?> pointer, int steps) {
        boolean backwards = steps < 0;
        int taken = 0;
        while (taken < Math.abs(steps) && pointer.move(backwards)) {
            taken++;
        }
        if (taken == 0) {
            return "Cannot move " + pointer.getSource().getUid() + (backwards ? " up" : " down");
        }
        InsertionAddress addr = pointer.getAddr();
        if (!pointer.moveSource()) {
            return "Nothing moved";
        }
        return String.format("Moved %s %s %s", pointer.getSource().getUid(),
            addr.isAfter() ? "after" : "before", addr.getUid());
    }

    private Root root() throws IOException {
        if (!session.isLoaded() && properties.getFile() != null) {
            session.load(Path.of(properties.getFile()));
        }
        return session.getRoot();
    }

    private Snippet findSnippet(String id) throws IOException {
        Element el = root().findById(id)
            .orElseThrow(() -> new IllegalArgumentException("No element with ID " + id));
        if (!Elements.isSnippet(el)) {
            throw new IllegalArgumentException(id + " is not a snippet");
        }
        return (Snippet) el;
    }

    private Group findGroup(String id) throws IOException {
        Element el = root().findById(id)
            .orElseThrow(() -> new IllegalArgumentException("No element with ID " + id));
        if (!Elements.isGroup(el)) {
            throw new IllegalArgumentException(id + " is not a group");
        }
        return (Group) el;
    }
}
