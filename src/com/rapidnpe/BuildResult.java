package com.rapidnpe;

/**
 * Outcome of building a slicing tree: either the tree or the kind of failure.
 */
public class BuildResult {
    private final SlicingTree tree;
    private final ErrorKind errorKind;
    private final String message;

    private BuildResult(SlicingTree tree, ErrorKind errorKind, String message) {
        this.tree = tree;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static BuildResult success(SlicingTree tree) {
        return new BuildResult(tree, null, null);
    }

    public static BuildResult failure(ErrorKind errorKind, String message) {
        return new BuildResult(null, errorKind, message);
    }

    public boolean isSuccess() {
        return tree != null;
    }

    public SlicingTree getTree() {
        return tree;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }
}
