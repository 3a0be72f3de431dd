package com.dcruver.clippets.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * A group of snippets and/or sub-groups.
 *
 * Sub-groups are kept by name, in insertion order. All other children are kept
 * in document order with the group's {@link KeywordSet} first.
 */
public class Group extends Element {

    public static final String ROOT_NAME = "<ROOT>";

    private String name;
    private final List<String> tags;
    private final Map<String, Group> groups = new LinkedHashMap<>();
    private final List<Element> children = new ArrayList<>();

    /**
     * Creates the root group. The root supplies its own ID allocator.
     */
    protected Group(String name, ElementIds ids) {
        super(null, ids);
        this.name = name;
        this.tags = List.of();
    }

    public Group(String name, Group parent, String tagText) {
        super(parent);
        this.name = name;
        this.tags = parseTags(tagText);
        getRoot().registerTags(tags);
        children.add(new KeywordSet(this));
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.GROUP;
    }

    protected void initKeywordSet() {
        children.add(0, new KeywordSet(this));
    }

    private static List<String> parseTags(String tagText) {
        if (tagText == null || tagText.isBlank()) {
            return List.of();
        }
        return List.copyOf(new TreeSet<>(Arrays.asList(tagText.strip().split("\\s+"))));
    }

    public String getName() {
        return name;
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isRoot() {
        return getParent() == null;
    }

    public List<Element> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * The sub-groups in user defined order.
     */
    public List<Group> getOrderedGroups() {
        return List.copyOf(groups.values());
    }

    public Group getGroup(String groupName) {
        return groups.get(groupName);
    }

    /**
     * This group's ancestors, nearest first.
     */
    public List<Group> getParents() {
        List<Group> parents = new ArrayList<>();
        for (Group g = getParent(); g != null; g = g.getParent()) {
            parents.add(g);
        }
        return parents;
    }

    /**
     * Add a sub-group, or return the existing one with the same name.
     *
     * The name may carry a {@code [tag tag]} suffix. A new group's tags also
     * include all of this group's tags.
     */
    public Group addGroup(String nameWithTags) {
        return addGroup(nameWithTags, null);
    }

    /**
     * Like {@link #addGroup(String)}, but a new group is placed right after
     * {@code after} rather than at the end.
     */
    public Group addGroup(String nameWithTags, Group after) {
        if (nameWithTags.indexOf(':') >= 0) {
            throw new IllegalArgumentException("A group name cannot contain ':': " + nameWithTags);
        }
        int open = nameWithTags.indexOf('[');
        String groupName = nameOf(nameWithTags);
        checkName(groupName);
        String tagText = "";
        if (open >= 0) {
            int close = nameWithTags.indexOf(']', open);
            tagText = close < 0 ? nameWithTags.substring(open + 1) : nameWithTags.substring(open + 1, close);
        }

        Group existing = groups.get(groupName);
        if (existing != null) {
            return existing;
        }
        if (!tags.isEmpty()) {
            tagText = String.join(" ", tags) + " " + tagText;
        }
        Group group = new Group(groupName, this, tagText);
        insertGroup(group, after == null ? groups.size() : indexOfGroup(after) + 1);
        return group;
    }

    /**
     * Attach an existing group next to one of this group's sub-groups, or at
     * the end when neither {@code after} nor {@code before} is given.
     */
    public void addGroupAsGroup(Group child, Group after, Group before) {
        Group clash = groups.get(child.getName());
        if (clash != null && clash != child) {
            throw new IllegalArgumentException(
                "Group '" + fullName() + "' already has a sub-group named '" + child.getName() + "'");
        }
        groups.remove(child.getName());
        int p;
        if (after != null) {
            p = indexOfGroup(after) + 1;
        } else if (before != null) {
            p = indexOfGroup(before);
        } else {
            p = groups.size();
        }
        insertGroup(child, p);
    }

    public void removeGroup(Group child) {
        if (groups.get(child.getName()) == child) {
            groups.remove(child.getName());
        }
    }

    /**
     * Change the name of this group, keeping its position among its siblings.
     */
    public void rename(String newName) {
        String stripped = newName.strip();
        if (isRoot()) {
            throw new IllegalStateException("The root group cannot be renamed");
        }
        checkName(stripped);
        getParent().renameChildGroup(this, stripped);
        this.name = stripped;
    }

    /**
     * The group name part of a header fragment, without any {@code [tags]}.
     */
    public static String nameOf(String nameWithTags) {
        int open = nameWithTags.indexOf('[');
        return (open < 0 ? nameWithTags : nameWithTags.substring(0, open)).strip();
    }

    // ':' separates nesting levels and '[' starts the tags in a header line.
    private static void checkName(String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("A group name cannot be blank");
        }
        if (name.indexOf(':') >= 0 || name.indexOf('[') >= 0) {
            throw new IllegalArgumentException("A group name cannot contain ':' or '[': " + name);
        }
    }

    private void renameChildGroup(Group child, String newName) {
        if (child.getName().equals(newName)) {
            return;
        }
        if (groups.containsKey(newName)) {
            throw new IllegalArgumentException(
                "Group '" + fullName() + "' already has a sub-group named '" + newName + "'");
        }
        List<Group> ordered = new ArrayList<>(groups.values());
        groups.clear();
        for (Group g : ordered) {
            groups.put(g == child ? newName : g.getName(), g);
        }
    }

    private void insertGroup(Group child, int index) {
        List<Group> ordered = new ArrayList<>(groups.values());
        ordered.add(index, child);
        groups.clear();
        for (Group g : ordered) {
            groups.put(g.getName(), g);
        }
        child.setParent(this);
    }

    private int indexOfGroup(Group group) {
        int idx = indexOfIdentity(getOrderedGroups(), group);
        if (idx < 0) {
            throw new IllegalArgumentException(group.getName() + " is not a sub-group of " + name);
        }
        return idx;
    }

    public void add(Element child) {
        add(child, null, null);
    }

    /**
     * Insert a child after or before an existing child, or append it when
     * neither is given.
     */
    public void add(Element child, Element after, Element before) {
        if (child.getKind() == ElementKind.GROUP) {
            throw new IllegalArgumentException("Groups are added using addGroupAsGroup");
        }
        int p;
        if (after != null) {
            p = indexOfChild(after) + 1;
        } else if (before != null) {
            p = indexOfChild(before);
        } else {
            p = children.size();
        }
        children.add(p, child);
        child.setParent(this);
    }

    /**
     * Add a new, empty Markdown snippet at the start of this group.
     *
     * An empty snippet is dropped by the next {@link #clean()}, so it should
     * be given text first.
     */
    public Snippet addNew() {
        MarkdownSnippet snippet = new MarkdownSnippet(this);
        int p = !children.isEmpty() && children.get(0).getKind() == ElementKind.KEYWORD_SET ? 1 : 0;
        children.add(p, snippet);
        return snippet;
    }

    /**
     * Remove a child. A placeholder is added if no snippets remain.
     */
    public void remove(Element child) {
        children.removeIf(c -> c == child);
        if (!isRoot() && snippets().isEmpty() && !hasPlaceHolder()) {
            children.add(new PlaceHolder(this));
        }
    }

    private int indexOfChild(Element child) {
        int idx = indexOfIdentity(children, child);
        if (idx < 0) {
            throw new IllegalArgumentException(child.getKind().getDisplayName() + " is not a child of " + name);
        }
        return idx;
    }

    /**
     * Clean up this and all sub-groups.
     *
     * Empty children are removed, keyword sets are merged into one first
     * child and a placeholder is present exactly when a non-root group has no
     * snippets.
     */
    @Override
    public Optional<PreservedText> clean() {
        for (Group group : getOrderedGroups()) {
            group.clean();
        }

        ListIterator<Element> it = children.listIterator();
        while (it.hasNext()) {
            Optional<PreservedText> trailing = it.next().clean();
            trailing.ifPresent(it::add);
        }

        KeywordSet merged = null;
        for (Element child : children) {
            if (child.getKind() == ElementKind.KEYWORD_SET) {
                if (merged == null) {
                    merged = (KeywordSet) child;
                } else {
                    merged.addWords(((KeywordSet) child).getWords());
                }
            }
        }
        children.removeIf(c -> c.getKind() == ElementKind.KEYWORD_SET);
        children.removeIf(c -> c.getKind() != ElementKind.PLACEHOLDER && c.isEmpty());
        children.add(0, merged != null ? merged : new KeywordSet(this));

        if (!isRoot()) {
            if (!snippets().isEmpty()) {
                children.removeIf(c -> c.getKind() == ElementKind.PLACEHOLDER);
            } else if (!hasPlaceHolder()) {
                children.add(new PlaceHolder(this));
            } else {
                // Keep the first placeholder; pointers may reference it
                Element first = children.stream()
                    .filter(c -> c.getKind() == ElementKind.PLACEHOLDER)
                    .findFirst()
                    .orElseThrow();
                children.removeIf(c -> c.getKind() == ElementKind.PLACEHOLDER && c != first);
            }
        }
        return Optional.empty();
    }

    /**
     * A group is empty when it holds nothing but its keyword set and
     * placeholder and has no sub-groups.
     */
    @Override
    public boolean isEmpty() {
        return groups.isEmpty() && children.stream().allMatch(c ->
            c.getKind() == ElementKind.PLACEHOLDER
                || (c.getKind() == ElementKind.KEYWORD_SET && c.isEmpty()));
    }

    public Element nextChild(Element child) {
        return stepChild(child, 1);
    }

    public Element prevChild(Element child) {
        return stepChild(child, -1);
    }

    /**
     * Step to a sibling of the same basic kind: groups step through the
     * sub-groups, snippets and placeholders through each other.
     */
    private Element stepChild(Element child, int step) {
        List<? extends Element> peers;
        if (child.getKind() == ElementKind.GROUP) {
            peers = getOrderedGroups();
        } else if (child.getKind().isSnippetLike()) {
            peers = children.stream().filter(Elements::isSnippetLike).toList();
        } else {
            peers = children;
        }
        int idx = indexOfIdentity(peers, child);
        if (idx < 0) {
            return null;
        }
        int n = idx + step;
        return n >= 0 && n < peers.size() ? peers.get(n) : null;
    }

    public List<Snippet> snippets() {
        return children.stream()
            .filter(Elements::isSnippet)
            .map(Snippet.class::cast)
            .toList();
    }

    public boolean hasPlaceHolder() {
        return children.stream().anyMatch(c -> c.getKind() == ElementKind.PLACEHOLDER);
    }

    public KeywordSet getKeywordSet() {
        for (Element child : children) {
            if (child.getKind() == ElementKind.KEYWORD_SET) {
                return (KeywordSet) child;
            }
        }
        KeywordSet kws = new KeywordSet(this);
        children.add(0, kws);
        return kws;
    }

    /**
     * All the keywords applicable to this group's snippets.
     */
    public Set<String> keywords() {
        return getKeywordSet().getWords();
    }

    /**
     * Walk this group's sub-tree in document order.
     *
     * @see TreeWalker#walk(Group, Predicate, String, boolean)
     */
    public Iterable<Element> walk(Predicate<? super Element> predicate, String firstId, boolean backwards) {
        return TreeWalker.walk(this, predicate, firstId, backwards);
    }

    /**
     * The group before or after this one in document order.
     */
    public Optional<Group> stepGroup(boolean backwards) {
        return TreeWalker.neighbour(this, backwards, false, Elements::isGroup).map(Group.class::cast);
    }

    /**
     * The names of this group and its ancestors, joined with " : ".
     */
    public String fullName() {
        if (isRoot()) {
            return "";
        }
        String parentName = getParent().fullName();
        return parentName.isEmpty() ? name : parentName + " : " + name;
    }

    private String reprFullName() {
        if (isRoot() || getParent().isRoot()) {
            return name;
        }
        return getParent().reprFullName() + ":" + name;
    }

    /**
     * A group only outline of this sub-tree, one name per line.
     */
    public String outlineRepr() {
        List<String> lines = new ArrayList<>();
        appendOutline(lines);
        return String.join("\n", lines) + "\n";
    }

    private void appendOutline(List<String> lines) {
        lines.add(name);
        for (Group g : getOrderedGroups()) {
            g.appendOutline(lines);
        }
    }

    public String fullRepr() {
        return fullRepr(false);
    }

    /**
     * A multi-line representation of this sub-tree. Placeholders are never
     * shown; preserved text and IDs only with {@code details}.
     */
    @Override
    public String fullRepr(boolean details) {
        List<String> lines = new ArrayList<>();
        appendRepr(lines, details);
        return String.join("\n", lines) + "\n";
    }

    private void appendRepr(List<String> lines, boolean details) {
        lines.add("Group: " + reprFullName() + (details ? " " + getUid() : ""));
        lines.add(getKeywordSet().fullRepr(details));
        for (Element child : children) {
            switch (child.getKind()) {
                case KEYWORD_SET, PLACEHOLDER -> {
                }
                case PRESERVED_TEXT -> {
                    if (details) {
                        lines.add(child.fullRepr(true));
                    }
                }
                default -> lines.add(child.fullRepr(details));
            }
        }
        for (Group g : getOrderedGroups()) {
            g.appendRepr(lines, details);
        }
    }

    static int indexOfIdentity(List<? extends Element> elements, Element element) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == element) {
                return i;
            }
        }
        return -1;
    }
}
