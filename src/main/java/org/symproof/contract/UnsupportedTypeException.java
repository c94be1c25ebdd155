package org.symproof.contract;

import org.symproof.translate.TranslationException;

/**
 * 类型注解无法映射到任何 sort。
 */
public class UnsupportedTypeException extends TranslationException {

    public UnsupportedTypeException(String message, int line) {
        super(message, line);
    }
}
