package org.dxworks.mathrules.tree;

public enum NodeKind {
    ELEMENT,
    ATTRIBUTE,
    TEXT
}
