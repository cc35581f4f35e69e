package com.clausesplit.tree;

public class MalformedTreeException extends RuntimeException {
    private final int position;

    public MalformedTreeException(String message, int position) {
        super(position < 0 ? message : message + " (position " + position + ")");
        this.position = position;
    }

    public MalformedTreeException(String message) {
        this(message, -1);
    }

    /**
     * 出错词元的位置；无法定位到单个词元时为 -1。
     */
    public int getPosition() {
        return position;
    }
}
