package de.zeus.planner.model;

/**
 * A user-drawn override covering {@code [start, end)}.
 * <p>
 * The action is read from {@code action}, {@code content} or {@code title}; if none is set it
 * is guessed from the id and finally from the group. Background items and lane spacers of the
 * timeline UI are ignored.
 */
public class ManualPlanEntry {

    private String id;
    private String action;
    private String content;
    private String title;
    private String group;
    private String type;
    private String className;
    private String start;
    private String end;

    public ManualPlanEntry() {
    }

    public ManualPlanEntry(String id, String action, String start, String end) {
        this.id = id;
        this.action = action;
        this.start = start;
        this.end = end;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getGroup() {
        return group;
    }

    public void setGroup(String group) {
        this.group = group;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getClassName() {
        return className;
    }

    public void setClassName(String className) {
        this.className = className;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }
}
