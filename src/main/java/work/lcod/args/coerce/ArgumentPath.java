package work.lcod.args.coerce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Location of a value inside an argument: field names and list indices, outermost first.
 */
public final class ArgumentPath {
    private static final ArgumentPath ROOT = new ArgumentPath(List.of());

    private final List<Object> segments;

    private ArgumentPath(List<Object> segments) {
        this.segments = segments;
    }

    public static ArgumentPath root() {
        return ROOT;
    }

    public static ArgumentPath of(String argumentName) {
        return ROOT.field(argumentName);
    }

    public ArgumentPath field(String name) {
        return append(name);
    }

    public ArgumentPath index(int index) {
        return append(index);
    }

    public List<Object> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * Renders {@code contacts[1].email}.
     */
    public String render() {
        var out = new StringBuilder();
        for (Object segment : segments) {
            if (segment instanceof Integer index) {
                out.append('[').append(index).append(']');
            } else {
                if (out.length() > 0) {
                    out.append('.');
                }
                out.append(segment);
            }
        }
        return out.toString();
    }

    private ArgumentPath append(Object segment) {
        var next = new ArrayList<Object>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new ArgumentPath(Collections.unmodifiableList(next));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ArgumentPath path && path.segments.equals(segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
