package com.mainframe.fixedwidth.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.NonNull;

/**
 * One declaration of a layout file: a keyword, its positional arguments and {@code key=value}
 * options. {@code schema} statements own the statements of their block.
 */
@Getter
public class LayoutStatement {

    private final int line;

    @NonNull
    private final String keyword;

    @NonNull
    private final List<String> arguments;

    @NonNull
    private final Map<String, String> options;

    private final List<LayoutStatement> children = new ArrayList<>();

    public LayoutStatement(int line, @NonNull String keyword, @NonNull List<String> arguments,
            @NonNull Map<String, String> options) {
        this.line = line;
        this.keyword = keyword;
        this.arguments = List.copyOf(arguments);
        this.options = Collections.unmodifiableMap(options);
    }

    void addChild(LayoutStatement child) {
        children.add(child);
    }

    public List<LayoutStatement> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public String argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }
}
