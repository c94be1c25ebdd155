package org.symproof.expressions;

/**
 * 当 term 的 sort 与操作要求不符时抛出，例如把数值 term 当作公式使用。
 */
public class SortMismatchException extends IllegalArgumentException {

    public SortMismatchException(String message) {
        super(message);
    }
}
