package com.routerline.backend.compiler;

public enum LeafKind {
    NODE,      // set creates the node, delete removes the whole subtree
    PRESENCE,  // valueless flag
    LEAF,      // single value; delete drops the value token
    MULTI,     // repeated value; delete removes one member, or the whole leaf without a value
    COMPOUND   // one call, several paths in a fixed order
}
