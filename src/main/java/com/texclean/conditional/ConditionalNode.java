package com.texclean.conditional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One {@code \if...\else...\fi} construct. The root node has no tokens and only a "then" branch.
 */
public final class ConditionalNode {
    private final ConditionalKind kind;
    private final ConditionalToken open;
    private final ConditionalNode parent;
    private final List<ConditionalNode> thenChildren = new ArrayList<>();
    private final List<ConditionalNode> elseChildren = new ArrayList<>();
    private ConditionalToken elseToken;
    private ConditionalToken close;

    private ConditionalNode(ConditionalKind kind, ConditionalToken open, ConditionalNode parent) {
        this.kind = kind;
        this.open = open;
        this.parent = parent;
    }

    static ConditionalNode root() {
        return new ConditionalNode(null, null, null);
    }

    ConditionalNode openChild(ConditionalKind kind, ConditionalToken token) {
        ConditionalNode child = new ConditionalNode(kind, token, this);
        if (elseToken == null) {
            thenChildren.add(child);
        } else {
            elseChildren.add(child);
        }
        return child;
    }

    void markElse(ConditionalToken token) {
        this.elseToken = token;
    }

    void markClosed(ConditionalToken token) {
        this.close = token;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public ConditionalKind kind() {
        return kind;
    }

    public ConditionalToken open() {
        return open;
    }

    public ConditionalToken elseToken() {
        return elseToken;
    }

    public ConditionalToken close() {
        return close;
    }

    public ConditionalNode parent() {
        return parent;
    }

    public boolean hasElse() {
        return elseToken != null;
    }

    public boolean isClosed() {
        return close != null;
    }

    public List<ConditionalNode> thenChildren() {
        return Collections.unmodifiableList(thenChildren);
    }

    public List<ConditionalNode> elseChildren() {
        return Collections.unmodifiableList(elseChildren);
    }

    public static ConditionalKind classify(ConditionalToken token) {
        String compact = token.compactText();
        if (compact.equals("\\iffalse") || compact.equals("\\if0")) {
            return ConditionalKind.RESOLVED_FALSE;
        }
        if (compact.equals("\\iftrue") || compact.equals("\\if1")) {
            return ConditionalKind.RESOLVED_TRUE;
        }
        return ConditionalKind.UNKNOWN;
    }
}
