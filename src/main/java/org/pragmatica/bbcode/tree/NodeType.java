package org.pragmatica.bbcode.tree;

/**
 * Node variants of a document tree.
 */
public enum NodeType {
    DOCUMENT,
    ELEMENT,
    TEXT
}
